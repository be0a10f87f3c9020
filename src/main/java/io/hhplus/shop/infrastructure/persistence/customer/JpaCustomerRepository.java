package io.hhplus.shop.infrastructure.persistence.customer;

import io.hhplus.shop.domain.customer.Customer;
import io.hhplus.shop.domain.customer.CustomerRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface JpaCustomerRepository extends JpaRepository<Customer, UUID>, CustomerRepository {

    // Explicitly declare methods to resolve ambiguity with CustomerRepository
    @Override
    Optional<Customer> findById(UUID id);

    @Override
    boolean existsByEmail(String email);
}

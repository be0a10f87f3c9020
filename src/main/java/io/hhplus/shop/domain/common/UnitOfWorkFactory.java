package io.hhplus.shop.domain.common;

public interface UnitOfWorkFactory {

    UnitOfWork open();
}

package io.hhplus.shop.domain.readmodel;

import java.util.UUID;

/**
 * 읽기 모델 레코드. 애그리거트 식별자를 그대로 키로 사용한다.
 */
public interface ReadModel {

    UUID getId();
}

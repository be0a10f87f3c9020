package io.hhplus.shop.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 고객 관련 (CUS)
    // ====================================
    CUSTOMER_NOT_FOUND("CUS001", "고객을 찾을 수 없습니다"),
    DUPLICATE_EMAIL("CUS002", "이미 사용 중인 이메일입니다"),

    // ====================================
    // 상품 관련 (P)
    // ====================================
    PRODUCT_NOT_FOUND("P001", "상품을 찾을 수 없습니다"),

    // ====================================
    // 이벤트 파이프라인 관련 (EVT)
    // ====================================
    EVENT_SERIALIZATION_FAILED("EVT001", "도메인 이벤트 직렬화에 실패했습니다"),
    EVENT_STORE_APPEND_FAILED("EVT002", "이벤트 저장소 기록에 실패했습니다 (쓰기 저장소는 커밋됨)"),
    EVENT_DISPATCH_FAILED("EVT003", "이벤트 핸들러 처리에 실패했습니다 (쓰기 저장소는 커밋됨)"),

    // ====================================
    // Unit of Work 관련 (UOW)
    // ====================================
    UNIT_OF_WORK_CLOSED("UOW001", "이미 종료된 Unit of Work 입니다"),
    INVALID_TRACKING_STATE("UOW002", "애그리거트 변경 추적 상태가 올바르지 않습니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다");

    private final String code;
    private final String message;
}

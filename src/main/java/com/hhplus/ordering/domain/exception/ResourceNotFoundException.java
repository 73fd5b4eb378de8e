package com.hhplus.ordering.domain.exception;

/**
 * 식별자로 조회한 애그리거트가 존재하지 않을 때 발생하는 예외의 공통 부모
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    protected ResourceNotFoundException(String message) {
        super(message);
    }
}

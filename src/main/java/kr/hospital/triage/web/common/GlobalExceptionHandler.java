package kr.hospital.triage.web.common;

import kr.hospital.triage.domain.queue.QueueEmptyException;
import kr.hospital.triage.domain.queue.QueueFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    record ErrorResponse(String code, String message) {}

    // ========== 대기열 관련 예외 ==========
    @ExceptionHandler(QueueFullException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    ErrorResponse handleQueueFull(QueueFullException e) {
        return new ErrorResponse("QUEUE_FULL", e.getMessage());
    }

    @ExceptionHandler(QueueEmptyException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleQueueEmpty(QueueEmptyException e) {
        return new ErrorResponse("QUEUE_EMPTY", e.getMessage());
    }

    // ========== 요청 검증 예외 ==========
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return new ErrorResponse("INVALID_REQUEST", message);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleUnreadable(Exception e) {
        return new ErrorResponse("INVALID_REQUEST", "요청 형식이 올바르지 않습니다");
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleGenericException(Exception e) {
        log.error("처리되지 않은 예외 발생", e);
        return new ErrorResponse("INTERNAL_ERROR", "서버 내부 오류가 발생했습니다");
    }
}

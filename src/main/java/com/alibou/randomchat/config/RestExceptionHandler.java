package com.alibou.randomchat.config;

import com.alibou.randomchat.exception.ChatSyncException;
import com.alibou.randomchat.exception.PreconditionFailedException;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.exception.UserAlreadyWaitingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(ChatSyncException.class)
    public ResponseEntity<ProblemDetail> handleChatFailure(ChatSyncException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Ошибка запроса: {}", ex.getMessage(), ex);
        }
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        body.setTitle(ex.getClass().getSimpleName());
        return ResponseEntity.status(status).body(body);
    }

    private static HttpStatus statusOf(ChatSyncException ex) {
        if (ex instanceof PreconditionFailedException || ex instanceof UserAlreadyWaitingException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof StorageException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}

package com.xcodecompiledb.converter.controller;

import com.xcodecompiledb.converter.command.ConversionException;
import com.xcodecompiledb.converter.command.UnresolvedPrecompiledHeaderException;
import com.xcodecompiledb.converter.controller.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.util.regex.PatternSyntaxException;

@RestControllerAdvice(basePackageClasses = ConvertController.class)
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnresolvedPrecompiledHeaderException.class)
    public ResponseEntity<ApiErrorResponse> handleUnresolvedPch(UnresolvedPrecompiledHeaderException ex) {
        log.warn("[API] Unresolved PCH: {}", ex.getIncludePath());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler({ConversionException.class, PatternSyntaxException.class})
    public ResponseEntity<ApiErrorResponse> handleBadInput(RuntimeException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    // 缺少 file 分段、参数类型不对等请求本身的问题
    @ExceptionHandler({
            MissingServletRequestPartException.class,
            ServletRequestBindingException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("[API] Upload too large: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded log exceeds the maximum upload size");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("[API] Unsupported media type: {}", ex.getContentType());
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return error(status, ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}

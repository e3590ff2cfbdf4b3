package com.ke.hal.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ke.hal.common.ErrorResponse;
import com.ke.hal.exception.AssistantException;
import com.ke.hal.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.HandlerExceptionResolver;
import org.springframework.web.servlet.ModelAndView;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.validation.ConstraintViolationException;
import java.io.IOException;
import java.io.PrintWriter;

/**
 * 全局异常处理器，输出 {"error": {"type", "message", "code"}}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler implements HandlerExceptionResolver {

    private final ObjectMapper objectMapper;

    @Override
    public ModelAndView resolveException(HttpServletRequest request, HttpServletResponse response,
                                       Object handler, Exception ex) {
        if(ex instanceof AssistantException ae) {
            handleAssistantException(request, response, ae);
        } else if(ex instanceof MethodArgumentNotValidException manve) {
            handleValidationException(response, manve);
        } else if(ex instanceof ConstraintViolationException cve) {
            handleConstraintViolationException(response, cve);
        } else if(ex instanceof HttpMessageNotReadableException
                || ex instanceof ServletRequestBindingException
                || ex instanceof MethodArgumentTypeMismatchException
                || ex instanceof IllegalArgumentException) {
            log.warn("{} bad request: {}", request.getRequestURI(), ex.getMessage());
            writeErrorResponse(response, HttpStatus.BAD_REQUEST.value(), ErrorCode.INVALID_REQUEST.getCode(), ex.getMessage());
        } else if(ex instanceof HttpRequestMethodNotSupportedException) {
            writeErrorResponse(response, HttpStatus.METHOD_NOT_ALLOWED.value(), ErrorCode.INVALID_REQUEST.getCode(), ex.getMessage());
        } else {
            log.error(request.getRequestURI() + " with error: " + ex.getMessage(), ex);
            writeErrorResponse(response, HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorCode.SERVER_ERROR.getCode(),
                    "Internal server error");
        }
        return new ModelAndView();
    }

    private void handleAssistantException(HttpServletRequest request, HttpServletResponse response, AssistantException e) {
        int status = e.getCode().getHttpStatus();
        if(status >= 500) {
            log.error(request.getRequestURI() + " with error: " + e.getMessage(), e);
        } else {
            log.warn("{} rejected: {}", request.getRequestURI(), e.getMessage());
        }
        writeErrorResponse(response, status, e.getCode().getCode(), e.getMessage());
    }

    private void handleValidationException(HttpServletResponse response, MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation error: {}", message);
        writeErrorResponse(response, HttpStatus.BAD_REQUEST.value(), ErrorCode.INVALID_REQUEST.getCode(), message);
    }

    private void handleConstraintViolationException(HttpServletResponse response, ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Constraint violation");
        log.warn("Constraint violation: {}", message);
        writeErrorResponse(response, HttpStatus.BAD_REQUEST.value(), ErrorCode.INVALID_REQUEST.getCode(), message);
    }

    private void writeErrorResponse(HttpServletResponse response, int statusCode, String code, String message) {
        ErrorResponse body = new ErrorResponse(new ErrorResponse.ErrorBody(typeOf(statusCode), message, code));
        try {
            response.setStatus(statusCode);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding("UTF-8");

            PrintWriter writer = response.getWriter();
            writer.write(objectMapper.writeValueAsString(body));
            writer.flush();
        } catch (IOException ex) {
            log.error("Failed to write error response", ex);
        }
    }

    private static String typeOf(int statusCode) {
        if(statusCode == HttpStatus.NOT_FOUND.value()) {
            return "not_found_error";
        }
        if(statusCode == HttpStatus.CONFLICT.value()) {
            return "conflict_error";
        }
        if(statusCode == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return "rate_limit_error";
        }
        if(statusCode >= 500) {
            return "api_error";
        }
        return "invalid_request_error";
    }
}

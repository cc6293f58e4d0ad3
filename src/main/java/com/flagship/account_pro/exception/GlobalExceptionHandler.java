package com.flagship.account_pro.exception;

import com.flagship.account_pro.web.AccountPages;
import com.flagship.account_pro.web.HtmlView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Renders the error page for unmatched routes and unexpected failures.
 *
 * A path variable that is not a number counts as an unmatched route.
 */
@ControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final AccountPages pages;

    @ExceptionHandler({
        NoHandlerFoundException.class,
        NoResourceFoundException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ModelAndView handleNotFound(Exception e) {
        log.debug("No route: {}", e.getMessage());
        return errorPage(HttpStatus.NOT_FOUND, "Page not found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ModelAndView handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        log.debug("Method not allowed: {}", e.getMessage());
        return errorPage(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    @ExceptionHandler(Exception.class)
    public ModelAndView handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return errorPage(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ModelAndView errorPage(HttpStatus status, String message) {
        ModelAndView mav = new ModelAndView(new HtmlView(pages.error(status.value(), message)));
        mav.setStatus(status);
        return mav;
    }
}

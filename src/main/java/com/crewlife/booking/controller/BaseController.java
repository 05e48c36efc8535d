package com.crewlife.booking.controller;

import com.crewlife.booking.dto.ErrorResponse;
import com.crewlife.booking.service.AccessResult;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Maps flow results onto HTTP responses. Every response is marked uncacheable
 * and sent without a referrer so tokens never leak through caches or Referer headers.
 */
@RestController
public abstract class BaseController {

    protected ResponseEntity<Object> respond(AccessResult<?> result) {
        ResponseEntity.BodyBuilder builder = result.isSuccess()
            ? ResponseEntity.ok()
            : ResponseEntity.status(result.getError().getHttpStatus());
        builder.cacheControl(CacheControl.noStore())
            .header("Referrer-Policy", "no-referrer");

        if (result.isSuccess()) {
            return builder.body(result.getValue());
        }
        return builder.body(new ErrorResponse(result.getError().name(), result.getMessage(),
            result.isRetryable(), result.getRemainingAttempts()));
    }
}

package com.travelbooking.backend.global.error;

import java.util.Locale;
import java.util.regex.Pattern;

import com.travelbooking.backend.global.web.RequestIdFilter;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

/**
 * Problem-details body of every error response. {@code code} is the stable machine-readable error
 * code; {@code requestId} repeats the {@code X-Request-Id} of the failed request so a client report
 * can be matched with the server log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    private static final String TYPE_PREFIX = "https://travel-booking.app/errors/";
    private static final Pattern NON_SLUG_CHARACTERS = Pattern.compile("[^a-z0-9]+");

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String errorCode = StringUtils.hasText(code) ? code : status.name();
        String slug = NON_SLUG_CHARACTERS.matcher(errorCode.toLowerCase(Locale.ROOT)).replaceAll("-");
        return new ProblemResponse(
                TYPE_PREFIX + slug,
                status.getReasonPhrase(),
                status.value(),
                StringUtils.hasText(detail) ? detail : status.getReasonPhrase(),
                instance,
                errorCode,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)
        );
    }
}

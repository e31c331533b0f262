package ch.so.arp.rag.pipeline;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps failures of the HTTP client onto the pipeline's error taxonomy right at
 * the API boundary.
 */
final class OpenAiErrorTranslator {

    private static final Pattern RETRY_AFTER_MESSAGE = Pattern.compile("retry after (\\d{1,9}) seconds?",
            Pattern.CASE_INSENSITIVE);

    private OpenAiErrorTranslator() {
    }

    static RagPipelineException translate(String operation, RestClientException ex) {
        if (ex instanceof RestClientResponseException response) {
            return translateResponse(operation, response);
        }
        if (ex instanceof ResourceAccessException) {
            return new TransientFailureException(operation + " could not reach the service: " + ex.getMessage(), ex);
        }
        return new PermanentFailureException(operation + " received an unreadable response: " + ex.getMessage(), ex);
    }

    private static RagPipelineException translateResponse(String operation, RestClientResponseException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String message = operation + " failed with HTTP " + status.value() + ": " + ex.getResponseBodyAsString();
        if (status.value() == 429) {
            return new RateLimitException(message, retryAfter(ex), ex);
        }
        if (status.value() == 401 || status.value() == 403) {
            return new ConfigurationException(operation + " was rejected, check the API key (HTTP "
                    + status.value() + ")", ex);
        }
        if (status.is5xxServerError() || status.value() == 408) {
            return new TransientFailureException(message, ex);
        }
        return new PermanentFailureException(message, ex);
    }

    static Duration retryAfter(RestClientResponseException ex) {
        HttpHeaders headers = ex.getResponseHeaders();
        String header = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (header != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(header.trim()));
            } catch (NumberFormatException ignored) {
                // HTTP date form, fall back to the message
            }
        }
        Matcher matcher = RETRY_AFTER_MESSAGE.matcher(ex.getResponseBodyAsString());
        if (matcher.find()) {
            return Duration.ofSeconds(Long.parseLong(matcher.group(1)));
        }
        return null;
    }
}

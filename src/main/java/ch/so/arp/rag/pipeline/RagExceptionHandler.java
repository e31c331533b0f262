package ch.so.arp.rag.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates pipeline failures escaping {@link RagController} into problem
 * responses.
 */
@RestControllerAdvice(assignableTypes = RagController.class)
public class RagExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ProblemDetail handleConfiguration(ConfigurationException ex) {
        LOGGER.error("Configuration error: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
        problem.setTitle("Configuration error");
        return problem;
    }

    @ExceptionHandler(RagPipelineException.class)
    public ProblemDetail handlePipeline(RagPipelineException ex) {
        LOGGER.warn("Pipeline failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
        problem.setTitle("Upstream service failure");
        return problem;
    }
}

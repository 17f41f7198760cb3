package fwapi.adapter.in.problem;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * Problem Details responses of the firewall VM endpoints.
 *
 * <p>Besides the RFC 7807 members, every problem carries a {@code code}
 * member with the error name clients match on ({@code InvalidParameters},
 * {@code ResourceNotFound}, {@code ServiceUnavailable}).
 */
public final class FirewallProblem {

    static final Response.StatusType UNPROCESSABLE_ENTITY = new Response.StatusType() {
        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Status.Family getFamily() {
            return Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    };

    private FirewallProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Validation Errors ==========

    /**
     * Create a 422 problem listing every invalid request parameter.
     *
     * @param errors the invalid parameters, in request order
     * @return validation problem with {@code code} and {@code errors} members
     */
    public static HttpProblem invalidParameters(List<InvalidParam> errors) {
        return HttpProblem.builder()
                .withTitle("Invalid Parameters")
                .withStatus(UNPROCESSABLE_ENTITY)
                .withDetail("Invalid parameters")
                .with("code", "InvalidParameters")
                .with("errors", errors.stream().map(InvalidParam::toMap).toList())
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem vmNotFound(String vmUuid) {
        return HttpProblem.builder()
                .withTitle("VM Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("VM %s not found".formatted(vmUuid))
                .with("code", "ResourceNotFound")
                .build();
    }

    // ========== Backend Errors ==========

    /**
     * Create a 503 problem for a backend failure. Requests failing this way
     * may have been partially applied and are safe to retry.
     *
     * @param detail the error detail message
     * @return service unavailable problem
     */
    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .with("code", "ServiceUnavailable")
                .build();
    }

    /**
     * One invalid request parameter.
     *
     * @param field   the parameter name
     * @param code    machine-readable error code
     * @param message human-readable message
     */
    public record InvalidParam(String field, String code, String message) {

        public static InvalidParam invalidUuid(String field) {
            return new InvalidParam(field, "InvalidParameter", "Invalid UUID");
        }

        Map<String, String> toMap() {
            final Map<String, String> map = new LinkedHashMap<>();
            map.put("field", field);
            map.put("code", code);
            map.put("message", message);
            return map;
        }
    }
}

package fwapi.adapter.in.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import fwapi.adapter.in.problem.FirewallProblem;
import fwapi.adapter.in.problem.FirewallProblem.InvalidParam;

/**
 * Validates UUID request parameters before any backend call is made.
 */
public final class UuidValidator {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}$", Pattern.CASE_INSENSITIVE);

    private UuidValidator() {}

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    /**
     * Validate the parameters of the {@code /firewalls/vms/{uuid}} endpoints.
     *
     * <p>All invalid parameters are reported together. An {@code owner_uuid}
     * that is present but empty is invalid.
     *
     * @param uuid      the VM id path parameter
     * @param ownerUuid the owner_uuid query parameter, null when absent
     * @throws io.quarkiverse.resteasy.problem.HttpProblem 422 if any parameter is invalid
     */
    public static void validateVmParams(String uuid, String ownerUuid) {
        final List<InvalidParam> errors = new ArrayList<>();

        if (!isUuid(uuid)) {
            errors.add(InvalidParam.invalidUuid("uuid"));
        }
        if (ownerUuid != null && !isUuid(ownerUuid)) {
            errors.add(InvalidParam.invalidUuid("owner_uuid"));
        }

        if (!errors.isEmpty()) {
            throw FirewallProblem.invalidParameters(errors);
        }
    }
}

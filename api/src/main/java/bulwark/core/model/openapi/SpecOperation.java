package bulwark.core.model.openapi;

import java.util.List;
import java.util.Map;

/**
 * One HTTP operation on a path.
 *
 * @param tags        grouping tags
 * @param summary     short description
 * @param operationId unique operation id
 * @param responses   status code to description
 * @param security    accepted security requirements, each mapping a scheme to scopes
 */
public record SpecOperation(
        List<String> tags,
        String summary,
        String operationId,
        Map<String, String> responses,
        List<Map<String, List<String>>> security) {}

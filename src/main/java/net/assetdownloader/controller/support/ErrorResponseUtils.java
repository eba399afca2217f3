package net.assetdownloader.controller.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (details != null && !details.isEmpty()) {
            body.put("details", List.copyOf(details));
        }
        return body;
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, List<String> details) {
        return ResponseEntity.status(status).body(errorBody(message, details));
    }

    public static ResponseEntity<Map<String, Object>> badRequest(String message, List<String> details) {
        return error(HttpStatus.BAD_REQUEST, message, details);
    }
}

package com.gymadmin.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Turns captured request and response payloads into audit snapshots.
 * <p>
 * Credential fields never reach a snapshot. Financial actions are mapped onto one canonical field set whatever
 * spelling the request used; other actions keep only a shape summary of the body.
 */
@Component
public class AuditPayloadSanitizer {

    public static final String CREATE_MEMBER = "CREATE_MEMBER";
    public static final String PROCESS_MEMBER_RENEWAL = "PROCESS_MEMBER_RENEWAL";
    static final String REDACTED = "[REDACTED]";
    static final String UNKNOWN_PACKAGE = "Unknown Package";

    private static final Set<String> FINANCIAL_ACTIONS = Set.of(CREATE_MEMBER, PROCESS_MEMBER_RENEWAL);

    private static final Set<String> CREDENTIAL_KEYS = Set.of(
            "pin", "staffpin", "staff_pin", "newpin", "new_pin", "pin_hash", "pinhash",
            "password", "national_id", "nationalid",
            "token", "sessiontoken", "session_token", "accesstoken", "access_token", "refreshtoken", "refresh_token"
    );

    private final Clock clock;

    public AuditPayloadSanitizer(Clock clock) {
        this.clock = clock;
    }

    public static boolean isFinancial(String action) {
        return FINANCIAL_ACTIONS.contains(action);
    }

    public static boolean isCredentialKey(String key) {
        return key != null && CREDENTIAL_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }

    public Map<String, Object> requestSnapshot(String action, String method, String path, Map<String, String> params,
                                               Map<String, String> query, Object body, String contentType,
                                               String userAgent) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("method", method);
        snapshot.put("path", path);
        snapshot.put("params", redact(params));
        snapshot.put("query", redact(query));
        snapshot.put("body", sanitizeBody(action, body));
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put("content-type", contentType);
        headers.put("user-agent", userAgent);
        snapshot.put("headers", headers);
        return snapshot;
    }

    public Map<String, Object> sanitizeBody(String action, Object body) {
        if (body == null) {
            return null;
        }
        if (isFinancial(action) && body instanceof Map<?, ?> map) {
            return financialRequest(map);
        }
        return summary(action, body);
    }

    public Map<String, Object> responseSnapshot(String action, int statusCode, Object body) {
        boolean success = statusCode < 400;
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", success ? "success" : "error");
        snapshot.put("success", success);
        snapshot.put("timestamp", OffsetDateTime.now(clock).toString());

        Map<?, ?> root = body instanceof Map<?, ?> map ? map : Map.of();
        Object data = root.containsKey("data") ? root.get("data") : body;

        if (isFinancial(action)) {
            Map<?, ?> payload = data instanceof Map<?, ?> map ? map : Map.of();
            snapshot.put("member_id", firstPresent(payload, "id", "member.id", "memberId"));
            snapshot.put("renewal_id", firstPresent(payload, "renewal.id", "renewalId"));
            snapshot.put("transaction_successful", success);
            snapshot.put("amount_processed", firstPresent(payload, "amount_paid", "package_price", "amountPaid"));
            snapshot.put("new_expiry_date",
                    firstPresent(payload, "member.expiry_date", "new_expiry", "expiryDate"));
            snapshot.put("member_name", memberName(payload));
            snapshot.put("package_name", firstPresent(payload, "package.name", "packageName"));
            snapshot.put("message", root.get("message"));
            return snapshot;
        }

        snapshot.put("record_count", data == null ? 0 : (data instanceof Collection<?> items ? items.size() : 1));
        snapshot.put("has_data", data != null);
        snapshot.put("message", root.get("message"));
        return snapshot;
    }

    private Map<String, Object> financialRequest(Map<?, ?> body) {
        Object packageType = firstPresent(body, "package_type", "packageType");
        Object packageName = firstPresent(body, "package_name", "packageName");

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("package_price",
                firstPresent(body, "customPrice", "amountPaid", "package_price", "packagePrice", "totalAmount"));
        audit.put("payment_method", firstPresent(body, "paymentMethod", "payment_method"));
        audit.put("package_name", packageName != null ? packageName : UNKNOWN_PACKAGE);
        audit.put("package_type", packageType);
        audit.put("package_id", firstPresent(body, "packageId", "package_id"));
        audit.put("duration_months", firstPresent(body, "duration", "duration_months", "durationMonths"));
        audit.put("member_type", packageType);
        audit.put("branch_id", firstPresent(body, "branchId", "branch_id"));
        audit.put("staff_id", firstPresent(body, "staffId", "staff_id"));
        audit.put("staff_pin_provided", isPresent(body.get("staffPin")) ? "YES" : "NO");
        audit.put("member_first_name", firstPresent(body, "firstName", "first_name"));
        audit.put("member_last_name", firstPresent(body, "lastName", "last_name"));
        audit.put("member_email", firstPresent(body, "email"));
        audit.put("start_date", firstPresent(body, "startDate", "start_date"));
        audit.put("expiry_date", firstPresent(body, "expiryDate", "expiry_date"));
        audit.put("total_amount", firstPresent(body, "amountPaid", "totalAmount"));
        return audit;
    }

    private Map<String, Object> summary(String action, Object body) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("operation_type", action);
        summary.put("resource_count", body instanceof Collection<?> items ? items.size() : 1);

        List<String> keys = new ArrayList<>();
        boolean sensitive = false;
        if (body instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (isCredentialKey(key)) {
                    sensitive = sensitive || isPresent(entry.getValue());
                } else {
                    keys.add(key);
                }
            }
        }
        summary.put("has_sensitive_data", sensitive);
        summary.put("data_keys", keys);
        return summary;
    }

    private Map<String, Object> redact(Map<String, String> values) {
        Map<String, Object> redacted = new LinkedHashMap<>();
        if (values == null) {
            return redacted;
        }
        values.forEach((key, value) -> redacted.put(key, isCredentialKey(key) ? REDACTED : value));
        return redacted;
    }

    private static Object memberName(Map<?, ?> payload) {
        Object name = firstPresent(payload, "member_name", "memberName");
        if (name != null) {
            return name;
        }
        Object first = payload.get("firstName");
        Object last = payload.get("lastName");
        if (isPresent(first) && isPresent(last)) {
            return first + " " + last;
        }
        Object memberFirst = lookup(payload, "member.first_name");
        Object memberLast = lookup(payload, "member.last_name");
        if (isPresent(memberFirst) && isPresent(memberLast)) {
            return memberFirst + " " + memberLast;
        }
        return null;
    }

    /**
     * First non-blank value among the given keys. Dotted keys walk nested maps.
     */
    static Object firstPresent(Map<?, ?> source, String... keys) {
        for (String key : keys) {
            Object value = lookup(source, key);
            if (isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    private static Object lookup(Map<?, ?> source, String dottedKey) {
        Object current = source;
        for (String part : dottedKey.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return true;
    }
}

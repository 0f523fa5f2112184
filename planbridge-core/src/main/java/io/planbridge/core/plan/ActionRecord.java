package io.planbridge.core.plan;

import java.util.Map;
import java.util.Objects;

/// One action emitted by the Generating or Reflecting backend.
///
/// The action vocabulary belongs to the engine, so the record keeps the decoded fields as
/// an ordered map and only interprets the action type.
///
/// @param fields decoded action fields in wire order, not null
public record ActionRecord(Map<String, Object> fields) {

    public ActionRecord {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = ModelCopies.orderedMap(fields);
    }

    public static ActionRecord of(Map<String, Object> fields) {
        return new ActionRecord(fields);
    }

    /// Returns the action type, read from `type` and then `action`.
    ///
    /// @return action type, `unknown` when neither field is a string
    public String type() {
        Object type = fields.get("type");
        if (type instanceof String s) {
            return s;
        }
        Object action = fields.get("action");
        if (action instanceof String s) {
            return s;
        }
        return "unknown";
    }

    public Object get(String key) {
        return fields.get(key);
    }
}

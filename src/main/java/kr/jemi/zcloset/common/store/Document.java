package kr.jemi.zcloset.common.store;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 문서 저장소에 저장되는 단위. 모든 필드 값은 문자열로 저장한다.
 */
public record Document(String key, Map<String, String> fields) {

    public Document {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("문서 키는 비어 있을 수 없습니다");
        }
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public String require(String name) {
        String value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("필수 필드 누락: " + name + " (key=" + key + ")");
        }
        return value;
    }

    public Instant requireInstant(String name) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(require(name)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("시각 필드 형식 오류: " + name + " (key=" + key + ")", e);
        }
    }

    public boolean hasFieldValue(String name, String value) {
        return value != null && value.equals(fields.get(name));
    }

    public static final class Builder {

        private final String key;
        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder(String key) {
            this.key = key;
        }

        public Builder field(String name, String value) {
            fields.put(name, value);
            return this;
        }

        public Builder field(String name, Instant value) {
            fields.put(name, Long.toString(value.toEpochMilli()));
            return this;
        }

        public Document build() {
            return new Document(key, fields);
        }
    }
}

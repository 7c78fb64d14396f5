package kr.jemi.zcloset.common.store;

/**
 * 구독과 조회의 대상. 키 하나로 지정하거나 필드 값 일치로 지정한다.
 */
public record DocumentQuery(String collection, String field, String value) {

    public static final String KEY = "__key";

    public DocumentQuery {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("컬렉션 이름이 필요합니다");
        }
        if (field == null || field.isBlank() || value == null) {
            throw new IllegalArgumentException("쿼리 조건이 올바르지 않습니다");
        }
    }

    public static DocumentQuery byKey(String collection, String key) {
        return new DocumentQuery(collection, KEY, key);
    }

    public static DocumentQuery byField(String collection, String field, String value) {
        return new DocumentQuery(collection, field, value);
    }

    public boolean isByKey() {
        return KEY.equals(field);
    }

    public boolean matches(Document document) {
        if (isByKey()) {
            return value.equals(document.key());
        }
        return document.hasFieldValue(field, value);
    }

    /**
     * 변경 알림이 발행되는 토픽 이름.
     */
    public String topic() {
        return topic(collection, field, value);
    }

    public static String topic(String collection, String field, String value) {
        return collection + "/" + field + "/" + value;
    }
}

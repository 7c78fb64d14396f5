package kr.jemi.zcloset.common.store;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 여러 ID로 문서 키를 만들거나 ID 목록을 필드 하나에 담을 때 쓰는 인코딩.
 * 각 값은 URL 인코딩하므로 구분자(':' 와 ',')가 값 안에 있어도 서로 다른 조합이 같은 문자열이 되지 않는다.
 */
public final class DocumentKeys {

    private static final String KEY_SEPARATOR = ":";
    private static final String LIST_DELIMITER = ",";

    private DocumentKeys() {
    }

    public static String compose(String... parts) {
        return Arrays.stream(parts)
                .map(DocumentKeys::encode)
                .collect(Collectors.joining(KEY_SEPARATOR));
    }

    public static String joinList(Collection<String> values) {
        return values.stream()
                .sorted()
                .map(DocumentKeys::encode)
                .collect(Collectors.joining(LIST_DELIMITER));
    }

    public static Set<String> splitList(String joined) {
        return Arrays.stream(joined.split(LIST_DELIMITER))
                .filter(value -> !value.isEmpty())
                .map(value -> URLDecoder.decode(value, StandardCharsets.UTF_8))
                .collect(Collectors.toSet());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

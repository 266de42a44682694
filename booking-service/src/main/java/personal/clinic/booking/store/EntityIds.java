package personal.clinic.booking.store;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * 문서 식별자 유틸리티
 * 새 식별자는 24자리 hex 문자열 (4바이트 epoch seconds + 8바이트 난수)
 */
public final class EntityIds {

    private static final Pattern HEX_ID = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private EntityIds() {
    }

    public static String newId() {
        byte[] bytes = new byte[12];
        int seconds = (int) (System.currentTimeMillis() / 1000);
        bytes[0] = (byte) (seconds >>> 24);
        bytes[1] = (byte) (seconds >>> 16);
        bytes[2] = (byte) (seconds >>> 8);
        bytes[3] = (byte) seconds;
        byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        System.arraycopy(random, 0, bytes, 4, 8);
        return HEX.formatHex(bytes);
    }

    public static boolean isHexId(String raw) {
        return raw != null && HEX_ID.matcher(raw).matches();
    }

    /**
     * 조회 후보 목록: 정규화된 hex 형식을 먼저, 원문을 나중에
     * hex 형식이 아니면 원문만 반환
     */
    public static List<String> lookupCandidates(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (isHexId(trimmed)) {
            String normalized = trimmed.toLowerCase(Locale.ROOT);
            return normalized.equals(trimmed) ? List.of(normalized) : List.of(normalized, trimmed);
        }
        return List.of(trimmed);
    }

    /**
     * 정규화된 식별자로 먼저 조회하고, 없으면 원문 식별자로 다시 조회
     */
    public static <T> Optional<T> findWithFallback(String raw, Function<String, Optional<T>> finder) {
        for (String candidate : lookupCandidates(raw)) {
            Optional<T> found = finder.apply(candidate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}

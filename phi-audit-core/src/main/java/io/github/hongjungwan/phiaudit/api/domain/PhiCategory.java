package io.github.hongjungwan.phiaudit.api.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 이름이 붙은 PHI/PII 탐지 규칙. 마스킹 시 {@code [REDACTED_<NAME>]} 토큰으로 치환.
 *
 * <p>내장 패턴은 모두 선형 시간 매칭을 전제로 작성됨: 소유 수량자(possessive), 상한이 있는 반복,
 * 연속 구간의 시작에서만 매칭을 시도하도록 하는 look-behind.</p>
 *
 * <p>숫자형 패턴(ssn, phone, creditCard)은 앞뒤가 영숫자가 아닐 때만 매칭. 해시, 토큰 같은
 * 영숫자 식별자 안의 숫자열은 건드리지 않음.</p>
 */
public record PhiCategory(String name, Pattern pattern) {

    private static final Pattern NAME_FORMAT = Pattern.compile("[A-Za-z][A-Za-z0-9]{0,63}");

    public static final PhiCategory EMAIL = of("email",
            "(?<![A-Za-z0-9._%+-])[A-Za-z0-9._%+-]++@(?:[A-Za-z0-9-]++\\.)+[A-Za-z]{2,}+");

    public static final PhiCategory MEDICAL_RECORD_NUMBER = new PhiCategory("medicalRecordNumber",
            Pattern.compile("(?:MRN|patient_id|PatientID)[\\s:#]*+\\d{5,}+", Pattern.CASE_INSENSITIVE));

    public static final PhiCategory DATE_OF_BIRTH = new PhiCategory("dateOfBirth",
            Pattern.compile("(?:DOB|date_of_birth|birth_date)[\\s:]*+\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}+",
                    Pattern.CASE_INSENSITIVE));

    public static final PhiCategory SSN = of("ssn",
            "(?<![A-Za-z0-9])\\d{3}-\\d{2}-\\d{4}(?![A-Za-z0-9])");

    public static final PhiCategory PHONE = of("phone",
            "(?:\\+1[-.\\s]?|(?<![A-Za-z0-9]))"
                    + "(?:\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}|\\d{3}[-.\\s]\\d{4})(?![A-Za-z0-9])");

    public static final PhiCategory CREDIT_CARD = of("creditCard",
            "(?<![A-Za-z0-9])(?:\\d{4}[-\\s]?){3}\\d{4}(?![A-Za-z0-9])");

    public static final PhiCategory IP_ADDRESS = of("ipAddress",
            "\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    public PhiCategory {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        if (!NAME_FORMAT.matcher(name).matches()) {
            throw new IllegalArgumentException("PHI category name must be alphanumeric and start with a letter: " + name);
        }
    }

    /** 정규식 문자열로 카테고리 생성 */
    public static PhiCategory of(String name, String regex) {
        return new PhiCategory(name, Pattern.compile(regex));
    }

    /**
     * 내장 카테고리. 마스킹 적용 순서 그대로: email, medicalRecordNumber, dateOfBirth,
     * ssn, phone, creditCard, ipAddress.
     *
     * <p>phone이 creditCard보다 먼저 적용되어야 카드 번호 매칭이 인접한 전화번호 중간에서 시작하지 않음.</p>
     */
    public static List<PhiCategory> builtIns() {
        return List.of(EMAIL, MEDICAL_RECORD_NUMBER, DATE_OF_BIRTH, SSN, PHONE, CREDIT_CARD, IP_ADDRESS);
    }

    /** 치환 토큰 (예: [REDACTED_EMAIL]) */
    public String token() {
        return "[REDACTED_" + name.toUpperCase(Locale.ROOT) + "]";
    }
}

package com.infomedia.abacox.pnrquality.component.contactquality;

import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies a raw PNR contact line into email/phone shapes and checks whether the shape is
 * well formed and declared under a contact type that accepts it.
 * <p>
 * Shape detection reads the raw string; format validation reads the normalized string
 * (carrier prefix, locale suffix and usage marker removed). All patterns are compiled once
 * and shared, so every method here is safe to call concurrently.
 */
@Log4j2
public final class ContactClassifier {

    // "KQ/M+" style carrier/channel marker
    private static final Pattern CARRIER_PREFIX = Pattern.compile("^[A-Z]+/[A-Z]\\+");
    // "/EN" style locale marker
    private static final Pattern LOCALE_SUFFIX = Pattern.compile("/[A-Z]+$");
    // "-M" style usage marker
    private static final Pattern USAGE_SUFFIX = Pattern.compile("-[A-Z]$");

    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s+().,\\-]");

    private static final Pattern EMAIL_FORMAT =
            Pattern.compile("^[A-Za-z0-9._%+-]+@(?:[A-Za-z0-9-]+\\.)+[A-Za-z]{2,}$");
    private static final Pattern PHONE_FORMAT = Pattern.compile("^\\+?[0-9\\s\\-()]{7,25}$");

    private static final List<String> PHONE_KEYWORDS = List.of("-m", "-s", "tel", "phone", "mobile");
    private static final String EMAIL_AT_SUBSTITUTE = "//";

    private static final int MIN_PHONE_DIGITS = 7;
    // 70% expressed as a ratio of integers to keep the density check exact
    private static final int DIGIT_DENSITY_NUMERATOR = 7;
    private static final int DIGIT_DENSITY_DENOMINATOR = 10;

    private ContactClassifier() {
    }

    /**
     * Classifies one contact line. A null, empty or whitespace-only detail is never wrong
     * format.
     */
    public static ContactClassification classify(String contactType, String contactDetail) {
        Optional<ContactType> declaredType = ContactType.fromCode(contactType);

        boolean email = isEmailShaped(contactDetail);
        boolean phone = isPhoneShaped(contactDetail);
        String normalized = normalize(contactDetail);

        boolean validEmail = email
                && declaredType.map(ContactType::isEmailAllowed).orElse(false)
                && EMAIL_FORMAT.matcher(normalized.replace(EMAIL_AT_SUBSTITUTE, "@")).matches();
        boolean validPhone = phone
                && declaredType.map(ContactType::isPhoneAllowed).orElse(false)
                && PHONE_FORMAT.matcher(normalized).matches();

        // Unknown codes are classified by shape only
        boolean wronglyPlaced = declaredType
                .map(type -> (email && !type.isEmailAllowed()) || (phone && !type.isPhoneAllowed()))
                .orElse(false);

        boolean wrongFormat = contactDetail != null && !contactDetail.isBlank() && !validEmail && !validPhone;

        log.trace("Classified contact type='{}' detail='{}': email={}, phone={}, validEmail={}, validPhone={}, wronglyPlaced={}",
                contactType, contactDetail, email, phone, validEmail, validPhone, wronglyPlaced);
        return new ContactClassification(email, phone, validEmail, validPhone, wronglyPlaced, wrongFormat, normalized);
    }

    /**
     * True when the contact is a valid email or phone under its declared type.
     */
    public static boolean isReachable(String contactType, String contactDetail) {
        return classify(contactType, contactDetail).isReachable();
    }

    public static boolean isEmailShaped(String contactDetail) {
        if (contactDetail == null || contactDetail.isBlank()) {
            return false;
        }
        boolean hasDot = contactDetail.contains(".");
        return hasDot && (contactDetail.contains("@") || contactDetail.contains(EMAIL_AT_SUBSTITUTE));
    }

    public static boolean isPhoneShaped(String contactDetail) {
        if (contactDetail == null || contactDetail.isBlank()) {
            return false;
        }
        String lower = contactDetail.toLowerCase(Locale.ROOT);
        for (String keyword : PHONE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }

        String compact = PHONE_SEPARATORS.matcher(normalize(contactDetail)).replaceAll("");
        if (compact.isEmpty()) {
            return false;
        }
        long digits = compact.chars().filter(Character::isDigit).count();
        return digits >= MIN_PHONE_DIGITS
                && digits * DIGIT_DENSITY_DENOMINATOR >= (long) compact.length() * DIGIT_DENSITY_NUMERATOR;
    }

    /**
     * Removes the carrier prefix, the locale suffix and the usage marker, in that order.
     *
     * @param contactDetail raw contact detail, may be null
     * @return the trimmed core value, never null
     */
    public static String normalize(String contactDetail) {
        if (contactDetail == null) {
            return "";
        }
        String value = contactDetail.trim();
        value = CARRIER_PREFIX.matcher(value).replaceFirst("");
        value = LOCALE_SUFFIX.matcher(value).replaceFirst("");
        value = USAGE_SUFFIX.matcher(value).replaceFirst("");
        return value.trim();
    }
}

package com.hydromat.tooling.code;

import com.hydromat.tooling.exception.ToolCodeValidationException;
import com.hydromat.tooling.model.ToolPosition;
import com.hydromat.tooling.model.ToolType;

import java.util.Locale;

/**
 * Builds and reads the 6-digit tool code.
 *
 * <pre>
 * digit 1    position   1=Bottom 2=Top 3=Right 4=Left
 * digit 2    tool type  0=Straight 1=Profile
 * digits 3-5 profile id 001..999
 * digit 6    set number 1..9
 * </pre>
 *
 * The first five digits identify a tool set; members of a set differ only in the last digit.
 */
public final class ToolCodeGenerator {

    public static final int CODE_LENGTH = 6;
    public static final int SET_PREFIX_LENGTH = 5;

    public static final int MIN_PROFILE_ID = 1;
    public static final int MAX_PROFILE_ID = 999;
    public static final int MIN_SET_NUMBER = 1;
    public static final int MAX_SET_NUMBER = 9;

    private ToolCodeGenerator() {
    }

    /**
     * Generates a code from the operator-facing labels ("Bottom", "Profile", ...).
     *
     * @throws ToolCodeValidationException naming the first offending field
     */
    public static String generate(int profileId, String position, String toolType, int setNumber) {
        requireProfileId(profileId);
        ToolPosition resolvedPosition = ToolPosition.fromLabel(position)
                .orElseThrow(() -> new ToolCodeValidationException(
                        "position", position, "Invalid position: " + position));
        ToolType resolvedType = ToolType.fromLabel(toolType)
                .orElseThrow(() -> new ToolCodeValidationException(
                        "toolType", toolType, "Invalid tool type: " + toolType));
        return generate(profileId, resolvedPosition, resolvedType, setNumber);
    }

    public static String generate(int profileId, ToolPosition position, ToolType toolType, int setNumber) {
        requireProfileId(profileId);
        if (position == null) {
            throw new ToolCodeValidationException("position", null, "Invalid position: null");
        }
        if (toolType == null) {
            throw new ToolCodeValidationException("toolType", null, "Invalid tool type: null");
        }
        if (setNumber < MIN_SET_NUMBER || setNumber > MAX_SET_NUMBER) {
            throw new ToolCodeValidationException("setNumber", setNumber,
                    "Set number must be 1-9, got " + setNumber);
        }
        return new StringBuilder(CODE_LENGTH)
                .append(position.getDigit())
                .append(toolType.getDigit())
                .append(String.format(Locale.ROOT, "%03d", profileId))
                .append(setNumber)
                .toString();
    }

    /**
     * Reads a code back into its fields.
     * Unknown position or type digits fall back to Bottom and Profile; only a wrong length or
     * non-numeric profile/set digits make the code unreadable.
     *
     * @return decoded fields, or {@code null} when the code cannot be read
     */
    public static DecodedToolCode decode(String code) {
        if (code == null || code.length() != CODE_LENGTH) {
            return null;
        }
        if (!isAsciiDigits(code, 2, CODE_LENGTH)) {
            return null;
        }
        ToolPosition position = ToolPosition.fromDigit(code.charAt(0)).orElse(ToolPosition.BOTTOM);
        ToolType toolType = ToolType.fromDigit(code.charAt(1)).orElse(ToolType.PROFILE);
        int profileId = Integer.parseInt(code.substring(2, 5));
        int setNumber = code.charAt(5) - '0';
        return new DecodedToolCode(position, toolType, profileId, setNumber);
    }

    public static boolean validateCode(String code) {
        return decode(code) != null;
    }

    /**
     * Returns the set key (position, type and profile digits) of a readable code, else {@code null}.
     */
    public static String setPrefix(String code) {
        if (!validateCode(code)) {
            return null;
        }
        return code.substring(0, SET_PREFIX_LENGTH);
    }

    private static void requireProfileId(int profileId) {
        if (profileId < MIN_PROFILE_ID || profileId > MAX_PROFILE_ID) {
            throw new ToolCodeValidationException("profileId", profileId,
                    "Profile ID must be 1-999, got " + profileId);
        }
    }

    private static boolean isAsciiDigits(String value, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}

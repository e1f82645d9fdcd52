package com.hydromat.tooling.code;

import com.hydromat.tooling.exception.ToolCodeValidationException;
import com.hydromat.tooling.model.ToolPosition;
import com.hydromat.tooling.model.ToolType;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCodeGeneratorTest {

    @Test
    void generate_concatenatesPositionTypeProfileAndSetDigits() {
        assertThat(ToolCodeGenerator.generate(7, "Top", "Profile", 3)).isEqualTo("210073");
        assertThat(ToolCodeGenerator.generate(1, "Bottom", "Straight", 1)).isEqualTo("100011");
        assertThat(ToolCodeGenerator.generate(999, "Left", "Straight", 9)).isEqualTo("409999");
        assertThat(ToolCodeGenerator.generate(42, ToolPosition.RIGHT, ToolType.PROFILE, 5)).isEqualTo("310425");
    }

    @Test
    void generate_isDeterministic() {
        String first = ToolCodeGenerator.generate(123, "Right", "Straight", 4);
        String second = ToolCodeGenerator.generate(123, "Right", "Straight", 4);

        assertThat(first).isEqualTo(second).hasSize(ToolCodeGenerator.CODE_LENGTH);
    }

    @Test
    void decode_invertsGenerateForEveryValidInput() {
        for (ToolPosition position : ToolPosition.values()) {
            for (ToolType type : ToolType.values()) {
                for (int profileId = ToolCodeGenerator.MIN_PROFILE_ID; profileId <= ToolCodeGenerator.MAX_PROFILE_ID; profileId++) {
                    for (int setNumber = ToolCodeGenerator.MIN_SET_NUMBER; setNumber <= ToolCodeGenerator.MAX_SET_NUMBER; setNumber++) {
                        String code = ToolCodeGenerator.generate(profileId, position.getLabel(), type.getLabel(), setNumber);

                        DecodedToolCode decoded = ToolCodeGenerator.decode(code);

                        assertThat(decoded).as(code).isNotNull();
                        assertThat(decoded.getPosition()).as(code).isEqualTo(position);
                        assertThat(decoded.getToolType()).as(code).isEqualTo(type);
                        assertThat(decoded.getProfileId()).as(code).isEqualTo(profileId);
                        assertThat(decoded.getSetNumber()).as(code).isEqualTo(setNumber);
                    }
                }
            }
        }
    }

    @Test
    void decode_readsProfileFromMiddleThreeDigits() {
        DecodedToolCode decoded = ToolCodeGenerator.decode("210073");

        assertThat(decoded).isNotNull();
        assertThat(decoded.getPosition()).isEqualTo(ToolPosition.TOP);
        assertThat(decoded.getToolType()).isEqualTo(ToolType.PROFILE);
        assertThat(decoded.getProfileId()).isEqualTo(7);
        assertThat(decoded.getSetNumber()).isEqualTo(3);

        assertThat(ToolCodeGenerator.decode("211003").getProfileId()).isEqualTo(100);
    }

    @Test
    void generate_usesAsciiDigitsWhateverTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
        try {
            String code = ToolCodeGenerator.generate(7, "Top", "Profile", 3);

            assertThat(code).isEqualTo("210073");
            assertThat(ToolCodeGenerator.decode(code)).isNotNull();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void generate_rejectsProfileIdOutsideRange() {
        assertThatThrownBy(() -> ToolCodeGenerator.generate(0, "Top", "Profile", 1))
                .isInstanceOf(ToolCodeValidationException.class)
                .hasMessage("Profile ID must be 1-999, got 0");
        assertThatThrownBy(() -> ToolCodeGenerator.generate(1000, "Top", "Profile", 1))
                .isInstanceOf(ToolCodeValidationException.class)
                .hasMessage("Profile ID must be 1-999, got 1000");
    }

    @Test
    void generate_rejectsSetNumberOutsideRange() {
        assertThatThrownBy(() -> ToolCodeGenerator.generate(5, "Top", "Profile", 0))
                .hasMessage("Set number must be 1-9, got 0");
        assertThatThrownBy(() -> ToolCodeGenerator.generate(5, "Top", "Profile", 10))
                .hasMessage("Set number must be 1-9, got 10");
    }

    @Test
    void generate_rejectsUnknownLabelsCaseSensitively() {
        assertThatThrownBy(() -> ToolCodeGenerator.generate(5, "top", "Profile", 1))
                .isInstanceOf(ToolCodeValidationException.class)
                .hasMessage("Invalid position: top");
        assertThatThrownBy(() -> ToolCodeGenerator.generate(5, "Top", "Round", 1))
                .isInstanceOf(ToolCodeValidationException.class)
                .hasMessage("Invalid tool type: Round");
    }

    @Test
    void generate_reportsProfileBeforeOtherFields() {
        assertThatThrownBy(() -> ToolCodeGenerator.generate(0, "Nowhere", "Round", 42))
                .isInstanceOfSatisfying(ToolCodeValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("profileId"));
    }

    @Test
    void decode_fallsBackForUnknownPositionAndTypeDigits() {
        DecodedToolCode decoded = ToolCodeGenerator.decode("901991");

        assertThat(decoded).isNotNull();
        assertThat(decoded.getPosition()).isEqualTo(ToolPosition.BOTTOM);
        assertThat(decoded.getToolType()).isEqualTo(ToolType.STRAIGHT);
        assertThat(decoded.getProfileId()).isEqualTo(199);
        assertThat(decoded.getSetNumber()).isEqualTo(1);

        assertThat(ToolCodeGenerator.decode("179991").getToolType()).isEqualTo(ToolType.PROFILE);
    }

    @Test
    void decode_rejectsStructurallyBrokenCodes() {
        assertThat(ToolCodeGenerator.decode(null)).isNull();
        assertThat(ToolCodeGenerator.decode("")).isNull();
        assertThat(ToolCodeGenerator.decode("21100")).isNull();
        assertThat(ToolCodeGenerator.decode("2110031")).isNull();
        assertThat(ToolCodeGenerator.decode("21A003")).isNull();
        assertThat(ToolCodeGenerator.decode("21100X")).isNull();
        assertThat(ToolCodeGenerator.validateCode("21 003")).isFalse();
        assertThat(ToolCodeGenerator.validateCode("210073")).isTrue();
    }

    @Test
    void setPrefix_isFirstFiveDigitsOfReadableCodes() {
        assertThat(ToolCodeGenerator.setPrefix("210073")).isEqualTo("21007");
        assertThat(ToolCodeGenerator.setPrefix("21100")).isNull();
    }
}

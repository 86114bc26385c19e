package github.sarthakdev143.scene_compiler.integration.manim;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorTableTest {

    private ColorTable colorTable;

    @BeforeEach
    void setUp() {
        colorTable = ColorTable.defaults();
    }

    @Test
    void primaryConstantsMapBothWays() {
        assertThat(colorTable.constantFor("#EF4444")).contains("RED");
        assertThat(colorTable.hexForConstant("red")).contains("#ef4444");
        assertThat(colorTable.constantFor("#123456")).isEmpty();
        assertThat(colorTable.constantFor("tomato")).isEmpty();
    }

    @Test
    void aliasesResolveToHexButNeverWinTheReverseLookup() {
        assertThat(colorTable.hexForConstant("GRAY")).contains("#6b7280");
        assertThat(colorTable.hexForConstant("BLUE_C")).contains("#3b82f6");
        assertThat(colorTable.constantFor("#6b7280")).contains("GREY");
        assertThat(colorTable.constantFor("#3b82f6")).contains("BLUE");
    }

    @Test
    void normalizeAcceptsHexAndCssNames() {
        assertThat(colorTable.normalize("#FFF")).contains("#ffffff");
        assertThat(colorTable.normalize(" Cyan ")).contains("#06b6d4");
        assertThat(colorTable.normalize("not-a-color")).isEmpty();
        assertThat(colorTable.normalize("")).isEmpty();
    }

    @Test
    void scriptLiteralPrefersConstants() {
        assertThat(colorTable.scriptLiteral("#22c55e")).isEqualTo("GREEN");
        assertThat(colorTable.scriptLiteral("white")).isEqualTo("WHITE");
        assertThat(colorTable.scriptLiteral("#123456")).isEqualTo("\"#123456\"");
    }

    @Test
    void duplicatePrimaryHexIsRejected() {
        assertThatThrownBy(() -> new ColorTable(Map.of("RED", "#ff0000", "CRIMSON", "#FF0000"), Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate hex value");
    }
}

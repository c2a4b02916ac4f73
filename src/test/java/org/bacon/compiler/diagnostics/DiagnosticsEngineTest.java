package org.bacon.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void newEngine_hasNoErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
        assertThat(engine.summary()).isEmpty();
        assertThat(engine.getSourceName()).isEqualTo("<memory>");
    }

    @Test
    void reportError_keepsOrderAndSourceName() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine("main.bacon");

        // Act
        engine.reportError("first", 1, 5);
        engine.reportError("second", 3, 2);

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.errorMessages()).containsExactly("first", "second");
        assertThat(engine.getDiagnostics()).containsExactly(
                new Diagnostic("first", "main.bacon", 1, 5),
                new Diagnostic("second", "main.bacon", 3, 2));
        assertThat(engine.summary()).isEqualTo(
                "[ERROR] main.bacon:1:5: first\n[ERROR] main.bacon:3:2: second");
    }

    @Test
    void getDiagnostics_isReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError("boom", 1, 1);

        assertThatThrownBy(() -> engine.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(engine.hasErrors()).isTrue();
    }
}

package org.bacon.repl;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReplConfigTest {

    @Test
    void fromConfig_readsReferenceDefaults() {
        ReplConfig config = ReplConfig.fromConfig(ConfigFactory.defaultReference());

        assertThat(config.prompt()).isEqualTo(">> ");
        assertThat(config.mode()).isEqualTo(ReplMode.PARSE);
        assertThat(config.showWelcomeMessage()).isTrue();
    }

    @Test
    void fromConfig_overridesWinOverDefaults() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            bacon.repl {
              prompt = "bacon> "
              mode = "Tokens"
              show-welcome-message = false
            }
            """).withFallback(ConfigFactory.defaultReference()).resolve();

        // Act
        ReplConfig replConfig = ReplConfig.fromConfig(config);

        // Assert
        assertThat(replConfig).isEqualTo(new ReplConfig("bacon> ", ReplMode.TOKENS, false));
        assertThat(replConfig.withMode(ReplMode.TREE).mode()).isEqualTo(ReplMode.TREE);
    }

    @Test
    void fromConfig_unknownMode_isBadValue() {
        Config config = ConfigFactory.parseString("bacon.repl.mode = evaluate")
                .withFallback(ConfigFactory.defaultReference()).resolve();

        assertThatThrownBy(() -> ReplConfig.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("evaluate");
    }
}

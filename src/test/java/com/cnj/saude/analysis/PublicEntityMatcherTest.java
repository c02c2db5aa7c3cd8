package com.cnj.saude.analysis;

import com.cnj.saude.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PublicEntityMatcherTest {

    private final PublicEntityMatcher matcher = new PublicEntityMatcher(PipelineConfig.DEFAULT_PUBLIC_ENTITY_KEYWORDS);

    @Test
    void shouldMatchKeywordIgnoringCaseAndAccents() {
        assertThat(matcher.matches("Município")).isTrue();
        assertThat(matcher.matches("autarquia federal")).isTrue();
        assertThat(matcher.matches("Órgão Público Autônomo")).isTrue();
    }

    @Test
    void shouldMatchAnyItemOfMultiValuedCell() {
        assertThat(matcher.matches("{Sociedade Empresaria, Estado ou Distrito Federal}")).isTrue();
    }

    @Test
    void shouldNotMatchPrivateParties() {
        assertThat(matcher.matches("Sociedade Empresaria Limitada")).isFalse();
        assertThat(matcher.matches("Pessoa Fisica")).isFalse();
    }

    @Test
    void shouldNotMatchBlankOrMissingCell() {
        assertThat(matcher.matches("")).isFalse();
        assertThat(matcher.matches(null)).isFalse();
    }

    @Test
    void shouldUseCustomKeywords() {
        PublicEntityMatcher custom = new PublicEntityMatcher(List.of("prefeitura"));

        assertThat(custom.matches("PREFEITURA DE NATAL")).isTrue();
        assertThat(custom.matches("Municipio")).isFalse();
    }
}

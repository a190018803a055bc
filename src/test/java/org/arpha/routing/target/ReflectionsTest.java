package org.arpha.routing.target;

import org.arpha.routing.fixture.ArticleController;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReflectionsTest {

    @Test
    void shouldMatchBoxedValuesToPrimitiveParameters() {
        assertThat(Reflections.accepts(new Class<?>[]{int.class, String.class}, new Object[]{1, "a"})).isTrue();
        assertThat(Reflections.accepts(new Class<?>[]{int.class}, new Object[]{1L})).isFalse();
        assertThat(Reflections.accepts(new Class<?>[]{int.class}, new Object[]{null})).isFalse();
        assertThat(Reflections.accepts(new Class<?>[]{String.class}, new Object[]{null})).isTrue();
        assertThat(Reflections.accepts(new Class<?>[]{String.class}, new Object[]{})).isFalse();
    }

    @Test
    void shouldFindMethodByNameAndArguments() {
        assertThat(Reflections.findMethod(ArticleController.class, "show", new Object[]{"a", "b"})).isPresent();
        assertThat(Reflections.findMethod(ArticleController.class, "show", new Object[]{"a"})).isEmpty();
        assertThat(Reflections.findMethod(ArticleController.class, "toString", new Object[]{})).isEmpty();
    }

    @Test
    void shouldPreferMostSpecificOverload() {
        assertThat(Reflections.findMethod(ArticleController.class, "label", new Object[]{"text"}))
                .hasValueSatisfying(method -> assertThat(method.getParameterTypes()).containsExactly(String.class));
        assertThat(Reflections.findMethod(ArticleController.class, "label", new Object[]{7}))
                .hasValueSatisfying(method -> assertThat(method.getParameterTypes()).containsExactly(Object.class));
    }

    @Test
    void shouldFindNothingForAmbiguousOverloads() {
        assertThat(Reflections.findMethod(ArticleController.class, "pair", new Object[]{"a", "b"})).isEmpty();
        assertThat(Reflections.findMethod(ArticleController.class, "pair", new Object[]{"a", 1}))
                .hasValueSatisfying(method -> assertThat(method.getParameterTypes())
                        .containsExactly(String.class, Object.class));
    }

}

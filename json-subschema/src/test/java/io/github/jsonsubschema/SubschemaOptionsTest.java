package io.github.jsonsubschema;

import io.github.jsonsubschema.semantic.SemanticTypeResolver;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class SubschemaOptionsTest extends SubschemaTestBase {

    @Test
    void defaultsReasonSemanticallyWithoutAGraph() {
        SubschemaOptions options = SubschemaOptions.DEFAULT;

        assertThat(options.semanticReasoning()).isTrue();
        assertThat(options.debug()).isFalse();
        assertThat(options.warnUninhabited()).isFalse();
        assertThat(options.semanticCacheDir()).isNull();
        assertThat(options.semanticGraphSources()).isEmpty();
        assertThat(options.lazyLoad()).isFalse();
    }

    @Test
    void graphSourcesAreDeduplicatedInOrder() {
        SubschemaOptions options = SubschemaOptions.DEFAULT
            .withSemanticGraphSources(List.of("b.ttl", "a.ttl", "b.ttl"))
            .withSemanticGraphSource("a.ttl")
            .withSemanticGraphSource("c.ttl");

        assertThat(options.semanticGraphSources()).containsExactly("b.ttl", "a.ttl", "c.ttl");
    }

    @Test
    void withersChangeOneSetting() {
        SubschemaOptions options = SubschemaOptions.DEFAULT
            .withDebug(true)
            .withSemanticCacheDir(Path.of("cache"));

        assertThat(options.debug()).isTrue();
        assertThat(options.semanticCacheDir()).isEqualTo(Path.of("cache"));
        assertThat(options.withSemanticReasoning(false))
            .isEqualTo(new SubschemaOptions(false, true, false, Path.of("cache"), List.of(), false));
        assertThat(SubschemaOptions.DEFAULT.withDebug(true).withDebug(false)).isEqualTo(SubschemaOptions.DEFAULT);
    }

    @Test
    void debugRaisesDiagnosticsToInfo() {
        assertThat(SubschemaOptions.DEFAULT.diagnosticLevel()).isEqualTo(Level.FINE);
        assertThat(SubschemaOptions.DEFAULT.withDebug(true).diagnosticLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void contextWithoutSourcesUsesIdentityOnlyResolver() {
        SubschemaContext context = SubschemaContext.defaults();

        assertThat(context.resolver().state()).isEqualTo(SemanticTypeResolver.State.UNINITIALIZED);
        assertThat(context.resolver().isSubtypeOf("ex:A", "ex:A")).isTrue();
        assertThat(context.resolver().isSubtypeOf("ex:A", "ex:B")).isFalse();
    }

    @Test
    void contextLoadsGraphSources() {
        SubschemaContext context = SubschemaContext.create(
            SubschemaOptions.DEFAULT.withSemanticGraphSource(ontology("employees.ttl")));

        assertThat(context.resolver().state()).isNotEqualTo(SemanticTypeResolver.State.UNINITIALIZED);
        assertThat(context.resolver().isSubtypeOf("ex:Manager", "foaf:Person")).isTrue();
    }

    @Test
    void disabledReasoningSkipsGraphLoading() {
        SubschemaContext context = SubschemaContext.create(SubschemaOptions.DEFAULT
            .withSemanticReasoning(false)
            .withSemanticGraphSource("does-not-exist.ttl"));

        assertThat(context.resolver().state()).isEqualTo(SemanticTypeResolver.State.UNINITIALIZED);
        assertThat(context.algebra().annotations()).isSameAs(AnnotationLattice.ignoring());
    }

    @Test
    void contextsDoNotShareGraphs() {
        SubschemaContext loaded = SubschemaContext.create(
            SubschemaOptions.DEFAULT.withSemanticGraphSource(ontology("employees.ttl")));
        SubschemaContext empty = SubschemaContext.defaults();

        assertThat(loaded.resolver().isSubtypeOf("ex:CEO", "ex:Employee")).isTrue();
        assertThat(empty.resolver().isSubtypeOf("ex:CEO", "ex:Employee")).isFalse();
    }
}

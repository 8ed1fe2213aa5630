package com.specdrift.variant;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.specdrift.model.Assertion;
import com.specdrift.model.Effect;
import com.specdrift.model.NamingStyle;
import com.specdrift.model.Parameter;
import com.specdrift.model.Specification;
import com.specdrift.naming.NamingTransformer;

public class VariantGenerator {
    private static final Logger log = LoggerFactory.getLogger(VariantGenerator.class);

    private final NamingTransformer namingTransformer;
    private final DependencyGraphBuilder graphBuilder;
    private final AssertionRewriter assertionRewriter;

    public VariantGenerator() {
        this(new NamingTransformer(), new DependencyGraphBuilder(), new AssertionRewriter());
    }

    public VariantGenerator(
            NamingTransformer namingTransformer,
            DependencyGraphBuilder graphBuilder,
            AssertionRewriter assertionRewriter) {
        this.namingTransformer = namingTransformer;
        this.graphBuilder = graphBuilder;
        this.assertionRewriter = assertionRewriter;
    }

    public List<Specification> namingVariants(Specification spec) {
        List<Specification> variants = new ArrayList<>();
        for (NamingStyle style : NamingStyle.values()) {
            variants.add(rewriteNaming(spec, style));
        }
        return List.copyOf(variants);
    }

    public List<Specification> effectOrderVariants(Specification spec, int maxVariants) {
        if (spec.effects().size() < 2 || maxVariants <= 0) {
            return List.of();
        }
        EffectDependencyGraph graph = graphBuilder.build(spec.effects());
        List<String> original = spec.effectDescriptions();
        int candidateLimit = (int) Math.min(Integer.MAX_VALUE, 2L * maxVariants);
        List<List<Effect>> orderings = graphBuilder.enumerateOrderings(graph, spec.effects(), candidateLimit);
        log.debug("Effect graph edges={} orderings={} for {}", graph.edgeCount(), orderings.size(), spec.signature().name());

        return orderings.stream()
                .filter(ordering -> !ordering.stream().map(Effect::description).toList().equals(original))
                .limit(maxVariants)
                .map(spec::withEffects)
                .toList();
    }

    public List<Specification> assertionRephrasings(Specification spec, int maxVariants) {
        List<Specification> variants = new ArrayList<>();
        List<Assertion> assertions = spec.assertions();
        for (int i = 0; i < assertions.size() && variants.size() < maxVariants; i++) {
            Assertion assertion = assertions.get(i);
            for (String rephrased : assertionRewriter.rephrase(assertion.predicate())) {
                if (variants.size() >= maxVariants) {
                    break;
                }
                List<Assertion> rewritten = new ArrayList<>(assertions);
                rewritten.set(i, assertion.withPredicate(rephrased));
                variants.add(spec.withAssertions(rewritten));
            }
        }
        return List.copyOf(variants);
    }

    public List<Specification> allVariants(Specification spec, int maxVariants) {
        List<Specification> variants = new ArrayList<>(namingVariants(spec));
        variants.addAll(effectOrderVariants(spec, maxVariants));
        variants.addAll(assertionRephrasings(spec, maxVariants));
        return variants.stream()
                .limit(Math.max(0, maxVariants))
                .toList();
    }

    private Specification rewriteNaming(Specification spec, NamingStyle style) {
        List<Parameter> parameters = spec.signature().parameters().stream()
                .map(parameter -> parameter.withName(namingTransformer.convert(parameter.name(), style)))
                .toList();
        List<Effect> effects = spec.effects().stream()
                .map(effect -> new Effect(namingTransformer.rewriteIdentifiersInText(effect.description(), style)))
                .toList();
        List<Assertion> assertions = spec.assertions().stream()
                .map(assertion -> assertion.withPredicate(
                        namingTransformer.rewriteIdentifiersInText(assertion.predicate(), style)))
                .toList();

        return new Specification(
                spec.intent(),
                spec.signature()
                        .withName(namingTransformer.convert(spec.signature().name(), style))
                        .withParameters(parameters),
                effects,
                assertions);
    }
}

package com.specdrift.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.specdrift.equivalence.EquivalenceConfiguration;
import com.specdrift.report.RobustnessGatePolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EquivalenceConfig equivalence = new EquivalenceConfig();
    private SandboxConfig sandbox = new SandboxConfig();
    private VariantsConfig variants = new VariantsConfig();
    private AnalysisConfig analysis = new AnalysisConfig();
    private GateConfig gate = new GateConfig();

    public EquivalenceConfig getEquivalence() {
        return equivalence;
    }

    public void setEquivalence(EquivalenceConfig equivalence) {
        this.equivalence = equivalence == null ? new EquivalenceConfig() : equivalence;
    }

    public SandboxConfig getSandbox() {
        return sandbox;
    }

    public void setSandbox(SandboxConfig sandbox) {
        this.sandbox = sandbox == null ? new SandboxConfig() : sandbox;
    }

    public VariantsConfig getVariants() {
        return variants;
    }

    public void setVariants(VariantsConfig variants) {
        this.variants = variants == null ? new VariantsConfig() : variants;
    }

    public AnalysisConfig getAnalysis() {
        return analysis;
    }

    public void setAnalysis(AnalysisConfig analysis) {
        this.analysis = analysis == null ? new AnalysisConfig() : analysis;
    }

    public GateConfig getGate() {
        return gate;
    }

    public void setGate(GateConfig gate) {
        this.gate = gate == null ? new GateConfig() : gate;
    }

    public EquivalenceConfiguration toEquivalenceConfiguration() {
        return new EquivalenceConfiguration(
                equivalence.isNormalizeNaming(),
                equivalence.isRequireEffectOrder(),
                equivalence.getIntentSimilarityThreshold(),
                equivalence.isUseFormalSolver());
    }

    public RobustnessGatePolicy toGatePolicy() {
        return new RobustnessGatePolicy(gate.getWarnRobustness(), gate.getFailRobustness(), gate.getTargetSensitivity());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EquivalenceConfig {
        private boolean normalizeNaming = true;
        private boolean requireEffectOrder = false;
        private double intentSimilarityThreshold = EquivalenceConfiguration.DEFAULT_INTENT_SIMILARITY_THRESHOLD;
        private boolean useFormalSolver = false;

        public boolean isNormalizeNaming() {
            return normalizeNaming;
        }

        public void setNormalizeNaming(boolean normalizeNaming) {
            this.normalizeNaming = normalizeNaming;
        }

        public boolean isRequireEffectOrder() {
            return requireEffectOrder;
        }

        public void setRequireEffectOrder(boolean requireEffectOrder) {
            this.requireEffectOrder = requireEffectOrder;
        }

        public double getIntentSimilarityThreshold() {
            return intentSimilarityThreshold;
        }

        public void setIntentSimilarityThreshold(double intentSimilarityThreshold) {
            this.intentSimilarityThreshold = intentSimilarityThreshold;
        }

        public boolean isUseFormalSolver() {
            return useFormalSolver;
        }

        public void setUseFormalSolver(boolean useFormalSolver) {
            this.useFormalSolver = useFormalSolver;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SandboxConfig {
        private long timeoutMs = 5000;
        private String javaCommand;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getJavaCommand() {
            return javaCommand;
        }

        public void setJavaCommand(String javaCommand) {
            this.javaCommand = javaCommand;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VariantsConfig {
        private int maxVariants = 5;

        public int getMaxVariants() {
            return maxVariants;
        }

        public void setMaxVariants(int maxVariants) {
            this.maxVariants = maxVariants;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalysisConfig {
        private int workerThreads = 1;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private double warnRobustness = 0.90;
        private double failRobustness = 0.80;
        private double targetSensitivity = 0.03;

        public double getWarnRobustness() {
            return warnRobustness;
        }

        public void setWarnRobustness(double warnRobustness) {
            this.warnRobustness = warnRobustness;
        }

        public double getFailRobustness() {
            return failRobustness;
        }

        public void setFailRobustness(double failRobustness) {
            this.failRobustness = failRobustness;
        }

        public double getTargetSensitivity() {
            return targetSensitivity;
        }

        public void setTargetSensitivity(double targetSensitivity) {
            this.targetSensitivity = targetSensitivity;
        }
    }
}

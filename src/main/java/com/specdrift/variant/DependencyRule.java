package com.specdrift.variant;

public enum DependencyRule {
    WRITE_AFTER_READ {
        @Override
        boolean applies(EffectTokens dependent, EffectTokens prerequisite) {
            return dependent.writes() && prerequisite.reads() && dependent.sharesSubjectWith(prerequisite);
        }
    },
    SHARED_DATABASE {
        @Override
        boolean applies(EffectTokens dependent, EffectTokens prerequisite) {
            return dependent.mentions("database")
                    && prerequisite.mentions("database")
                    && dependent.writes()
                    && prerequisite.reads();
        }
    },
    DESCRIPTION_CONTAINMENT {
        @Override
        boolean applies(EffectTokens dependent, EffectTokens prerequisite) {
            return !prerequisite.text().isBlank() && dependent.text().contains(prerequisite.text());
        }
    };

    abstract boolean applies(EffectTokens dependent, EffectTokens prerequisite);
}

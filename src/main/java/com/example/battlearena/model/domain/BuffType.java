package com.example.battlearena.model.domain;

/**
 * Kinds of passive buff a collectible can grant. Each kind knows how to fold itself into
 * the running {@link BuffTotals}, so adding a kind forces a decision here.
 */
public enum BuffType {
    ATTACK_PERCENT {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addAttackPercent(buff.getValue());
        }
    },
    DEFENSE_PERCENT {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addDefensePercent(buff.getValue());
        }
    },
    HEALTH_FLAT {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addHealthFlat((int) buff.getValue());
        }
    },
    ATTACK_FLAT {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addAttackFlat((int) buff.getValue());
        }
    },
    ALL_PERCENT {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addAttackPercent(buff.getValue());
            totals.addDefensePercent(buff.getValue());
        }
    },
    MIXED {
        @Override
        public void accumulate(Buff buff, BuffTotals totals) {
            totals.addAttackPercent(buff.getAttackPercent());
            totals.addHealthFlat(buff.getHealthFlat());
        }
    };

    public abstract void accumulate(Buff buff, BuffTotals totals);
}

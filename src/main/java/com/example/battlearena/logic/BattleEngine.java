package com.example.battlearena.logic;

import com.example.battlearena.model.domain.*;

/**
 * Combat rules for both battle modes.
 * Stateless apart from its dice; callers must hold the session's monitor.
 */
public class BattleEngine {

    static final double PLAYER_CRIT_CHANCE = 0.10;
    static final double OPPONENT_CRIT_CHANCE = 0.05;
    static final double CRIT_MULTIPLIER = 1.5;
    static final double STRONG_ATTACK_HIT_CHANCE = 0.70;
    static final double DEFEND_DAMAGE_FACTOR = 0.3;

    private final Dice dice;
    private final int awakeningTurns;

    public BattleEngine(Dice dice, int awakeningTurns) {
        this.dice = dice;
        this.awakeningTurns = awakeningTurns;
    }

    /**
     * Applies a player's action. A refused action leaves the session untouched.
     */
    public ActionResult applyAction(BattleSession session, String actorId, BattleAction action) {
        if (action == null || actorId == null
                || session.getPhase() != BattlePhase.AWAITING_ACTION
                || !actorId.equals(session.getCurrentTurnPlayerId())) {
            return ActionResult.rejected(actorId, action, ActionRejection.INVALID_ACTION);
        }

        CombatantState actor = session.getCombatant(actorId);
        CombatantState target = session.getOpponentOf(actorId);
        if (actor.isScripted()) {
            return ActionResult.rejected(actorId, action, ActionRejection.INVALID_ACTION);
        }

        if (action == BattleAction.USE_ABILITY) {
            return castAwakening(session, actor);
        }
        if (action == BattleAction.AWAKENED_ABILITY && !actor.getAwakenedState().isActive()) {
            return ActionResult.rejected(actorId, action, ActionRejection.NOT_ELIGIBLE);
        }

        session.setPhase(BattlePhase.RESOLVING_ACTION);
        actor.setDefending(false);

        ActionResult result = ActionResult.accepted(actorId, action);
        endExpiredAwakening(target, result);

        int damage = 0;
        switch (action) {
            case FAST_ATTACK:
                damage = rollDamage(actor.getPower(), 0.5, 0.1, PLAYER_CRIT_CHANCE, result);
                break;
            case STRONG_ATTACK:
                if (dice.chance(STRONG_ATTACK_HIT_CHANCE)) {
                    damage = rollDamage(actor.getPower(), 1.0, 0.2, PLAYER_CRIT_CHANCE, result);
                } else {
                    result.setMissed(true);
                }
                break;
            case DEFEND:
                actor.setDefending(true);
                break;
            case AWAKENED_ABILITY:
                damage = Awakening.forCharacter(actor.getAwakenedState().getCharacter())
                        .map(Awakening::getDamage)
                        .orElse(0);
                break;
            default:
                throw new IllegalStateException("Unhandled action " + action);
        }

        boolean guarded = false;
        if (action != BattleAction.DEFEND && !result.isMissed()) {
            guarded = target.isDefending();
            damage = absorb(target, damage);
            target.takeDamage(damage);
        } else if (result.isMissed()) {
            target.setDefending(false);
        }
        result.setDamage(damage);
        result.setMessage(describe(actor, target, action, result, guarded));

        // One charge of the awakening is spent per turn the awakened side takes
        if (actor.getAwakenedState().isActive()) {
            actor.getAwakenedState().setTurnsLeft(actor.getAwakenedState().getTurnsLeft() - 1);
        }

        session.appendLog(result.getMessage());
        passTurn(session, actor, target, result);
        return result;
    }

    /**
     * Resolves the scripted opponent's retaliation in a PvE session.
     *
     * @return the outcome, or {@code null} if no opponent turn was pending
     */
    public ActionResult resolveScriptedTurn(BattleSession session) {
        if (session.getPhase() != BattlePhase.AWAITING_OPPONENT) {
            return null;
        }
        String opponentId = session.getCurrentTurnPlayerId();
        CombatantState opponent = session.getCombatant(opponentId);
        CombatantState player = session.getOpponentOf(opponentId);
        session.setPhase(BattlePhase.RESOLVING_OPPONENT);

        ActionResult result = ActionResult.accepted(opponentId, null);
        endExpiredAwakening(player, result);

        int damage = rollDamage(opponent.getPower(), 0.8, 0.2, OPPONENT_CRIT_CHANCE, result);
        String message;
        if (player.isDefending()) {
            damage = (int) Math.floor(damage * DEFEND_DAMAGE_FACTOR);
            player.setDefending(false);
            message = String.format("%s attacks! %s defends and reduces the damage to %d!%s",
                    opponent.getName(), player.getName(), damage, critSuffix(result));
        } else {
            message = String.format("%s attacks and deals %d damage!%s",
                    opponent.getName(), damage, critSuffix(result));
        }
        player.takeDamage(damage);
        result.setDamage(damage);
        result.setMessage(message);

        session.appendLog(message);
        passTurn(session, opponent, player, result);
        return result;
    }

    /**
     * Returns control to the caster once the awakening cutscene delay has elapsed.
     *
     * @return false if the session was not waiting on a cutscene
     */
    public boolean finishAwakening(BattleSession session) {
        if (session.getPhase() != BattlePhase.AWAKENING) {
            return false;
        }
        session.setPhase(BattlePhase.AWAITING_ACTION);
        CombatantState caster = session.getCombatant(session.getCurrentTurnPlayerId());
        session.appendLog("The power of " + caster.getAwakenedState().getCharacter() + " flows through "
                + caster.getName() + "!");
        return true;
    }

    private ActionResult castAwakening(BattleSession session, CombatantState actor) {
        Awakening awakening = actor.getAvailableAwakening();
        if (awakening == null) {
            return ActionResult.rejected(actor.getId(), BattleAction.USE_ABILITY, ActionRejection.NOT_ELIGIBLE);
        }
        actor.setAbilityUsed(true);
        actor.setDefending(false);
        actor.getAwakenedState().begin(awakening, awakeningTurns);
        session.setPhase(BattlePhase.AWAKENING);

        ActionResult result = ActionResult.accepted(actor.getId(), BattleAction.USE_ABILITY);
        result.setAwakeningCast(awakening);
        result.setMessage(actor.getName() + " awakens the power of " + awakening.getCharacter() + "!");
        session.appendLog(result.getMessage());
        return result;
    }

    private void endExpiredAwakening(CombatantState combatant, ActionResult result) {
        if (combatant.getAwakenedState().isExpired()) {
            combatant.getAwakenedState().end();
            result.setAwakeningEndedFor(combatant.getId());
        }
    }

    private int rollDamage(int power, double ratio, double spread, double critChance, ActionResult result) {
        double variance = dice.variance(spread);
        boolean critical = dice.chance(critChance);
        result.setCritical(critical);
        return (int) Math.floor(power * ratio * variance * (critical ? CRIT_MULTIPLIER : 1.0));
    }

    // A defending target takes 30% of the hit and drops its guard. Lethal hits go through.
    private int absorb(CombatantState target, int damage) {
        if (!target.isDefending()) {
            return damage;
        }
        target.setDefending(false);
        if (damage == Awakening.LETHAL) {
            return damage;
        }
        return (int) Math.floor(damage * DEFEND_DAMAGE_FACTOR);
    }

    private void passTurn(BattleSession session, CombatantState actor, CombatantState target, ActionResult result) {
        if (target.isDefeated()) {
            session.setPhase(BattlePhase.FINISHED);
            session.setWinnerId(actor.getId());
            result.setFinished(true);
            return;
        }
        session.setCurrentTurnPlayerId(target.getId());
        session.setPhase(target.isScripted() ? BattlePhase.AWAITING_OPPONENT : BattlePhase.AWAITING_ACTION);
    }

    private static String describe(CombatantState actor, CombatantState target, BattleAction action,
            ActionResult result, boolean guarded) {
        String guard = guarded ? " " + target.getName() + " blocks most of it." : "";
        switch (action) {
            case FAST_ATTACK:
                return String.format("%s uses a Fast Attack and deals %d damage!%s%s",
                        actor.getName(), result.getDamage(), critSuffix(result), guard);
            case STRONG_ATTACK:
                if (result.isMissed()) {
                    return actor.getName() + " uses a Strong Attack, but misses!";
                }
                return String.format("%s uses a Strong Attack and deals %d damage!%s%s",
                        actor.getName(), result.getDamage(), critSuffix(result), guard);
            case DEFEND:
                return actor.getName() + " takes a defensive stance.";
            default:
                return String.format("%s uses %s and deals %d damage!",
                        actor.getName(), actor.getAwakenedState().getAbilityName(), result.getDamage());
        }
    }

    private static String critSuffix(ActionResult result) {
        return result.isCritical() ? " (CRITICAL!)" : "";
    }
}

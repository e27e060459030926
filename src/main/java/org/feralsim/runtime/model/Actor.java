package org.feralsim.runtime.model;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.Config;
import org.feralsim.runtime.combat.DamageRoller;
import org.feralsim.runtime.combat.RollOutcome;
import org.feralsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The resource and ability state machine of the simulated character.
 * <p>
 * An actor is created for a single trial and owns every mutable per-character value: form,
 * energy, rage, mana, combo points, cooldown timers and the current stats. Each ability method
 * performs its damage roll, pays its cost, updates resources, triggers on-hit procs and records
 * the cast. Resource pools are clamped to their bounds after every mutation.
 * </p>
 * <p>
 * The actor does not enforce the global cooldown or ability cooldowns; the event loop and the
 * rotation policy gate every call. It does refuse a cast it cannot pay for: such a call returns
 * {@link CastResult#rejected()} and leaves the actor unchanged.
 * </p>
 */
public class Actor {

    private static final Logger LOG = LoggerFactory.getLogger(Actor.class);

    private static final double OMEN_WHITE_RATE = 3.5 / 60;
    private static final double OMEN_BEAR_RATE = 3.5 / 60 * 2.5;
    private static final double JOW_CHANCE = 0.25;
    private static final double JOW_MANA = 70.0;
    private static final double MAUL_COST = 10.0;
    private static final double LACERATE_COST = 13.0;
    private static final double MANGLE_BEAR_COST = 15.0;
    private static final double SHIFT_BASE_MANA = 1224 * 0.4;

    private final ActorConfig config;
    private final EncounterState encounter;
    private final IRandomProvider rng;
    private final CombatLog log;
    private final CastStatistics statistics = new CastStatistics();
    private final List<ProcObserver> procObservers = new ArrayList<>();

    private final double[] stats = new double[StatTarget.values().length];

    private double missChance;
    private double dodgeChance;
    private double spellMissChance;
    private double regenFactor;
    private double baseRegen;
    private double fiveSecondRuleRegen;
    private final double shiftCost;
    private final double omenGiftRate;
    private final double roarFactor;
    private final double ripDuration;
    private final double rakeDuration;
    private final double biteCritBonus;
    private final double baseMangleCost;
    private final double baseRipCost;

    private DamageParameters damage;
    private boolean tigersFury;

    private Form form = Form.CAT;
    private double energy = Config.ENERGY_CAP;
    private double rage;
    private double mana;
    private int comboPoints;
    private double gcd;
    private double spellGcd = 1.5;
    private boolean omenProc;
    private boolean berserk;
    private boolean enrage;
    private boolean savageRoar;
    private boolean fiveSecondRule;
    private boolean readyToShift;
    private boolean readyToGift;
    private double lastShift = Double.NEGATIVE_INFINITY;

    private double ilotpCooldown;
    private double tigersFuryCooldown;
    private double berserkCooldown;
    private double enrageCooldown;
    private double mangleCooldown;
    private double faerieFireCooldown;
    private double runeCooldown;

    private double shredCost;
    private double rakeCost;
    private double mangleCost;
    private double biteCost;
    private double ripCost;
    private double roarCost;

    /**
     * Creates a fresh actor at the start of an encounter: Cat form, full energy and mana,
     * no combo points and every cooldown ready.
     *
     * @param config    the static character configuration
     * @param encounter the encounter whose armor debuffs feed the damage parameters
     * @param rng       the random source of the trial
     * @param log       the combat log, {@link CombatLog#disabled()} outside traced trials
     */
    public Actor(ActorConfig config, EncounterState encounter, IRandomProvider rng, CombatLog log) {
        this.config = config;
        this.encounter = encounter;
        this.rng = rng;
        this.log = log;

        for (StatTarget target : StatTarget.values()) {
            if (target.isActorAttribute()) {
                stats[target.ordinal()] = config.getStat(target);
            }
        }
        stats[StatTarget.CRIT_CHANCE.ordinal()] -= Config.CRIT_SUPPRESSION;

        this.shiftCost = SHIFT_BASE_MANA * (1 - 0.1 * config.getNaturalShapeshifter());
        this.omenGiftRate = 1 - Math.pow(1 - 0.0875, config.getGotwTargets());
        this.roarFactor = 0.3 + (config.isRoarGlyph() ? 0.03 : 0.0);
        this.ripDuration = 12 + (config.isRipGlyph() ? 4 : 0) + (config.isT7TwoPiece() ? 4 : 0);
        this.rakeDuration = 9 + (config.isT9TwoPiece() ? 3 : 0);
        this.biteCritBonus = 0.25 + (config.isT9FourPiece() ? 0.05 : 0.0);
        this.baseMangleCost = 40 - (config.isT6TwoPiece() ? 5 : 0) - 2 * config.getImprovedMangle();
        this.baseRipCost = 30 - (config.isT10TwoPiece() ? 10 : 0);

        this.mana = stat(StatTarget.MANA_POOL);
        updateMissChance();
        updateManaRegen();
        recalculateDamage();
        updateAbilityCosts();
    }

    // ---------------------------------------------------------------------
    // Stats
    // ---------------------------------------------------------------------

    private double stat(StatTarget target) {
        return stats[target.ordinal()];
    }

    /**
     * Adds an amount to one of the actor's stats and refreshes every value derived from it.
     *
     * @param target the stat to change, must be an actor attribute
     * @param amount the signed amount to add
     * @throws IllegalArgumentException if the stat is owned by the event loop
     */
    public void applyDelta(StatTarget target, double amount) {
        if (!target.isActorAttribute()) {
            throw new IllegalArgumentException(target + " is not an actor attribute");
        }
        stats[target.ordinal()] += amount;

        switch (target) {
            case HIT_CHANCE, MISS_CHANCE, EXPERTISE_RATING, SPELL_HIT_CHANCE -> updateMissChance();
            case INTELLECT, SPIRIT, MP5 -> updateManaRegen();
            case MANA_POOL -> mana = clamp(mana, 0.0, stat(StatTarget.MANA_POOL));
            case ATTACK_POWER, AGILITY, ARMOR_PEN_RATING, WEAPON_DAMAGE -> recalculateDamage();
            default -> {
                // crit and swing timer are read directly
            }
        }
    }

    private void updateMissChance() {
        double missReduction = Math.min(stat(StatTarget.HIT_CHANCE) * 100, 8.0);
        double dodgeReduction = Math.min(6.5,
                (10 + Math.floor(stat(StatTarget.EXPERTISE_RATING) / 8.1974973675)) * 0.25);
        this.missChance = Math.max(0.0, 0.01 * ((8.0 - missReduction) + (6.5 - dodgeReduction))
                + stat(StatTarget.MISS_CHANCE));
        this.dodgeChance = 0.01 * (6.5 - dodgeReduction);
        double spellMissReduction = Math.min(stat(StatTarget.SPELL_HIT_CHANCE) * 100, 17.0);
        this.spellMissChance = 0.01 * (17.0 - spellMissReduction);
    }

    private void updateManaRegen() {
        this.regenFactor = 0.016725 / 5 * Math.sqrt(Math.max(stat(StatTarget.INTELLECT), 0.0));
        double spiritRegen = stat(StatTarget.SPIRIT) * regenFactor;
        double bonusRegen = stat(StatTarget.MP5) / 5;
        this.baseRegen = spiritRegen + bonusRegen;
        this.fiveSecondRuleRegen = 0.5 / 3 * config.getIntensity() * spiritRegen + bonusRegen;
    }

    /**
     * Recomputes all damage bounds from the current stats, armor debuffs and Tiger's Fury state.
     */
    public void recalculateDamage() {
        this.damage = DamageParameters.compute(config, stat(StatTarget.ATTACK_POWER), stat(StatTarget.AGILITY),
                stat(StatTarget.ARMOR_PEN_RATING), stat(StatTarget.WEAPON_DAMAGE), encounter, tigersFury);
    }

    private void updateAbilityCosts() {
        double divisor = berserk ? 2.0 : 1.0;
        this.shredCost = 42.0 / divisor;
        this.rakeCost = 35.0 / divisor;
        this.mangleCost = baseMangleCost / divisor;
        this.biteCost = 35.0 / divisor;
        this.ripCost = baseRipCost / divisor;
        this.roarCost = 25.0 / divisor;
    }

    private double critMultiplier() {
        double multiplier = 2.0 * (config.isMetaGem() ? 1.03 : 1.0);
        if (form == Form.CAT) {
            // talent bonus is rounded to whole percents
            multiplier *= 1 + Math.round(config.getPredatoryInstincts() / 30.0 * 100) / 100.0;
        }
        return multiplier;
    }

    private double spellCritMultiplier() {
        return 1.5 * (config.isMetaGem() ? 1.03 : 1.0);
    }

    /**
     * @return the critical strike multiplier of bleed ticks in the current form
     */
    public double getCritMultiplier() {
        return critMultiplier();
    }

    // ---------------------------------------------------------------------
    // Procs
    // ---------------------------------------------------------------------

    /**
     * Registers an observer that is offered every landed attack.
     * @param observer the proc observer
     */
    public void addProcObserver(ProcObserver observer) {
        procObservers.add(observer);
    }

    private void checkProcs(boolean yellow, boolean crit) {
        if (config.isOmen() && !yellow) {
            double rate = form == Form.BEAR ? OMEN_BEAR_RATE : OMEN_WHITE_RATE;
            if (rng.nextDouble() < rate) {
                omenProc = true;
            }
        }
        if (config.isJudgementOfWisdom() && rng.nextDouble() < JOW_CHANCE) {
            addMana(JOW_MANA);
        }
        if (crit && ilotpCooldown < Config.EPSILON) {
            addMana(0.04 * config.getImprovedLeaderOfThePack() * stat(StatTarget.MANA_POOL));
            ilotpCooldown = Config.ILOTP_COOLDOWN;
        }
        notifyObservers(ProcTrigger.ANY, crit, yellow);
    }

    private void notifyObservers(ProcTrigger trigger, boolean crit, boolean yellow) {
        for (ProcObserver observer : procObservers) {
            observer.checkForProc(trigger, crit, yellow, rng);
        }
    }

    // ---------------------------------------------------------------------
    // Cat abilities
    // ---------------------------------------------------------------------

    /**
     * Resolves a melee auto attack. In Bear form a landed or dodged swing generates rage.
     *
     * @return the swing result, damage including the Savage Roar share
     */
    public CastResult swing() {
        boolean bear = form == Form.BEAR;
        double low = bear ? damage.whiteBearLow() : damage.whiteLow();
        double high = bear ? damage.whiteBearHigh() : damage.whiteHigh();
        double critChance = stat(StatTarget.CRIT_CHANCE) - (bear ? Config.BEAR_CRIT_PENALTY : 0.0);
        RollOutcome roll = DamageRoller.rollWhite(rng, low, high, missChance, critChance, critMultiplier());

        double dealt = roll.damage() * (enrage ? Config.ENRAGE_MULTIPLIER : 1.0);
        double roarDamage = form == Form.CAT && savageRoar ? roarFactor * dealt : 0.0;

        if (!roll.miss()) {
            checkProcs(false, roll.crit());
        }

        if (bear) {
            // a dodge still generates rage, so re-roll which kind of avoidance it was
            boolean dodge = roll.miss() && missChance > 0 && rng.nextDouble() < dodgeChance / missChance;
            double proxy = dodge ? 0.5 * (low + high) * (enrage ? Config.ENRAGE_MULTIPLIER : 1.0) : dealt;
            if (!roll.miss() || dodge) {
                double critBonus = roll.crit() ? 1.0 : 0.0;
                double rageGain = 15.0 / 4.0 / 453.3 * proxy + 2.5 / 2 * 3.5 * (1 + critBonus) + 5 * critBonus;
                rageGain = Math.min(rageGain, proxy * 15.0 / 453.3);
                rage = clamp(rage + rageGain, 0.0, Config.RAGE_CAP);
            }
        }

        statistics.recordCast(Ability.MELEE, dealt);
        statistics.addDamage(Ability.SAVAGE_ROAR, roarDamage);
        log.record("Melee", CombatLog.describe(dealt + roarDamage, roll.miss(), roll.crit(), false), this);
        return CastResult.of(dealt + roarDamage, !roll.miss(), roll.crit(), false);
    }

    /**
     * Executes a combo point builder.
     *
     * @param ability    the builder being cast, used for statistics
     * @param low        low end damage
     * @param high       high end damage
     * @param cost       energy cost
     * @param mangleMod  whether the Mangle bleed/damage debuff applies
     * @return the cast result, {@link CastResult#rejected()} if energy is short and no
     *         free-cast proc is pending
     */
    public CastResult executeBuilder(Ability ability, double low, double high, double cost, boolean mangleMod) {
        if (!omenProc && energy + Config.EPSILON < cost) {
            return CastResult.rejected();
        }
        RollOutcome roll = DamageRoller.rollYellow(rng, low, high, missChance, stat(StatTarget.CRIT_CHANCE),
                critMultiplier());
        double dealt = roll.damage() * (mangleMod ? Config.MANGLE_MULTIPLIER : 1.0);
        double roarDamage = savageRoar ? roarFactor * dealt : 0.0;
        gcd = Config.CAT_GCD;

        boolean clearcast = omenProc;
        if (clearcast) {
            omenProc = false;
        } else {
            energy = clamp(energy - cost * (roll.miss() ? 0.2 : 1.0), 0.0, Config.ENERGY_CAP);
        }

        int added = (roll.miss() ? 0 : 1) + (roll.crit() ? 1 : 0);
        comboPoints = Math.min(Config.MAX_COMBO_POINTS, comboPoints + added);

        if (!roll.miss()) {
            checkProcs(true, roll.crit());
        }

        statistics.recordCast(ability, dealt);
        statistics.addDamage(Ability.SAVAGE_ROAR, roarDamage);
        log.record(ability.getDisplayName(),
                CombatLog.describe(dealt + roarDamage, roll.miss(), roll.crit(), clearcast), this);
        return CastResult.of(dealt + roarDamage, !roll.miss(), roll.crit(), clearcast);
    }

    /**
     * Casts Shred.
     * @param mangleDebuff whether the Mangle debuff is on the target
     * @return the cast result
     */
    public CastResult shred(boolean mangleDebuff) {
        CastResult result = executeBuilder(Ability.SHRED, damage.shredLow(), damage.shredHigh(), shredCost,
                mangleDebuff);
        if (result.landed()) {
            notifyObservers(ProcTrigger.SHRED, false, true);
        }
        return result;
    }

    /**
     * Casts Rake. A landed Rake reports its per-tick damage in {@link CastResult#tickDamage()}.
     * @param mangleDebuff whether the Mangle debuff is on the target
     * @return the cast result
     */
    public CastResult rake(boolean mangleDebuff) {
        CastResult result = executeBuilder(Ability.RAKE, damage.rakeHit(), damage.rakeHit(), rakeCost, mangleDebuff);
        if (!result.accepted()) {
            return result;
        }
        return withTick(result, result.landed() ? damage.rakeTick() : 0.0);
    }

    /**
     * Casts Mangle in the current form. Bear Mangle starts its own cooldown.
     * @return the cast result
     */
    public CastResult mangle() {
        CastResult result;
        if (form == Form.CAT) {
            result = executeBuilder(Ability.MANGLE_CAT, damage.mangleLow(), damage.mangleHigh(), mangleCost, false);
        } else {
            result = executeBearSpecial(Ability.MANGLE_BEAR, damage.mangleBearLow(), damage.mangleBearHigh(),
                    MANGLE_BEAR_COST, true, false);
            if (result.accepted()) {
                mangleCooldown = Config.MANGLE_BEAR_COOLDOWN;
            }
        }
        if (result.landed()) {
            notifyObservers(ProcTrigger.MANGLE, false, true);
            if (form == Form.CAT) {
                notifyObservers(ProcTrigger.CAT_MANGLE, false, true);
            }
        }
        return result;
    }

    /**
     * Casts Ferocious Bite. The base cost is paid up front, up to 30 additional energy is
     * converted into damage, and a miss refunds most of the base cost.
     * @return the cast result, damage including the Savage Roar share
     */
    public CastResult bite() {
        if (comboPoints < 1 || (!omenProc && energy + Config.EPSILON < biteCost)) {
            return CastResult.rejected();
        }
        boolean clearcast = omenProc;
        if (clearcast) {
            omenProc = false;
        } else {
            energy = Math.max(0.0, energy - biteCost);
        }

        double extraEnergy = Math.min(energy, 30.0);
        double bonus = extraEnergy * (9.4 + stat(StatTarget.ATTACK_POWER) / 410.0) * damage.biteMultiplier();
        RollOutcome roll = DamageRoller.rollYellow(rng, damage.biteLow(comboPoints) + bonus,
                damage.biteHigh(comboPoints) + bonus, missChance, stat(StatTarget.CRIT_CHANCE) + biteCritBonus,
                critMultiplier());
        double roarDamage = savageRoar ? roarFactor * roll.damage() : 0.0;

        if (roll.miss()) {
            if (!clearcast) {
                energy = clamp(energy + 0.8 * biteCost, 0.0, Config.ENERGY_CAP);
            }
        } else {
            energy -= extraEnergy;
            comboPoints = 0;
        }
        gcd = Config.CAT_GCD;

        if (!roll.miss()) {
            checkProcs(true, roll.crit());
        }

        statistics.recordCast(Ability.FEROCIOUS_BITE, roll.damage());
        statistics.addDamage(Ability.SAVAGE_ROAR, roarDamage);
        log.record(Ability.FEROCIOUS_BITE.getDisplayName(),
                CombatLog.describe(roll.damage() + roarDamage, roll.miss(), roll.crit(), clearcast), this);
        return CastResult.of(roll.damage() + roarDamage, !roll.miss(), roll.crit(), clearcast);
    }

    /**
     * Casts Rip. A landed Rip consumes all combo points and reports its per-tick damage in
     * {@link CastResult#tickDamage()}; the ticks themselves are resolved by the event loop.
     * @return the cast result
     */
    public CastResult rip() {
        if (comboPoints < 1 || (!omenProc && energy + Config.EPSILON < ripCost)) {
            return CastResult.rejected();
        }
        boolean miss = rng.nextDouble() < missChance;
        double tick = miss ? 0.0 : damage.ripTick(comboPoints);
        gcd = Config.CAT_GCD;

        boolean clearcast = omenProc;
        if (clearcast) {
            omenProc = false;
        } else {
            energy = clamp(energy - ripCost * (miss ? 0.2 : 1.0), 0.0, Config.ENERGY_CAP);
        }
        if (!miss) {
            comboPoints = 0;
            checkProcs(true, false);
        }

        statistics.recordCast(Ability.RIP, 0.0);
        log.record(Ability.RIP.getDisplayName(), miss ? CombatLog.describe(0, true, false, clearcast)
                : clearcast ? "applied (clearcast)" : "applied", this);
        return new CastResult(true, 0.0, !miss, false, clearcast, tick);
    }

    /**
     * @param points combo points spent
     * @return the Savage Roar duration for that many combo points
     */
    public double savageRoarDuration(int points) {
        return Config.ROAR_DURATIONS[points] + (config.isT8FourPiece() ? Config.ROAR_T8_BONUS : 0.0);
    }

    /**
     * Casts Savage Roar. Roar cannot miss and never consumes a free-cast proc.
     * @return the cast result
     */
    public CastResult savageRoar() {
        if (comboPoints < 1 || energy + Config.EPSILON < roarCost) {
            return CastResult.rejected();
        }
        gcd = Config.CAT_GCD;
        energy = Math.max(0.0, energy - roarCost);
        savageRoar = true;
        comboPoints = 0;
        statistics.recordCast(Ability.SAVAGE_ROAR, 0.0);
        log.record(Ability.SAVAGE_ROAR.getDisplayName(), "applied", this);
        return CastResult.of(0.0, true, false, false);
    }

    /**
     * Casts Faerie Fire (Feral), which grants a guaranteed free-cast proc. In Bear form it also
     * deals spell damage.
     * @return the cast result
     */
    public CastResult faerieFire() {
        gcd = Config.CAT_GCD;
        omenProc = true;
        faerieFireCooldown = Config.FAERIE_FIRE_COOLDOWN;

        if (form != Form.BEAR) {
            statistics.recordCast(Ability.FAERIE_FIRE_CAT, 0.0);
            log.record(Ability.FAERIE_FIRE_CAT.getDisplayName(), "", this);
            return CastResult.of(0.0, true, false, false);
        }
        RollOutcome roll = DamageRoller.rollSpell(rng, damage.faerieFireHit(), damage.faerieFireHit(),
                spellMissChance, stat(StatTarget.SPELL_CRIT_CHANCE), spellCritMultiplier());
        double dealt = roll.damage() * (enrage ? Config.ENRAGE_MULTIPLIER : 1.0);
        statistics.recordCast(Ability.FAERIE_FIRE_BEAR, dealt);
        log.record(Ability.FAERIE_FIRE_BEAR.getDisplayName(),
                CombatLog.describe(dealt, roll.miss(), roll.crit(), false), this);
        return CastResult.of(dealt, !roll.miss(), roll.crit(), false);
    }

    // ---------------------------------------------------------------------
    // Bear abilities
    // ---------------------------------------------------------------------

    /**
     * Executes a rage-based special ability in Bear form.
     *
     * @param ability   the ability being cast, used for statistics
     * @param low       low end damage
     * @param high      high end damage
     * @param cost      rage cost
     * @param yellow    whether the ability is on the global cooldown and counts as yellow damage
     *                  for procs; Maul is neither
     * @param mangleMod whether the Mangle debuff applies
     * @return the cast result
     */
    public CastResult executeBearSpecial(Ability ability, double low, double high, double cost,
                                         boolean yellow, boolean mangleMod) {
        if (!omenProc && rage + Config.EPSILON < cost) {
            return CastResult.rejected();
        }
        RollOutcome roll = DamageRoller.rollYellow(rng, low, high, missChance,
                stat(StatTarget.CRIT_CHANCE) - Config.BEAR_CRIT_PENALTY, critMultiplier());
        double dealt = roll.damage() * (mangleMod ? Config.MANGLE_MULTIPLIER : 1.0)
                * (enrage ? Config.ENRAGE_MULTIPLIER : 1.0);
        if (yellow) {
            gcd = Config.BEAR_GCD;
        }

        boolean clearcast = omenProc;
        if (clearcast) {
            omenProc = false;
        } else {
            rage -= cost * (roll.miss() ? 0.2 : 1.0);
        }
        rage = clamp(rage + (roll.crit() ? 5.0 : 0.0), 0.0, Config.RAGE_CAP);

        if (!roll.miss()) {
            checkProcs(true, roll.crit());
        }

        statistics.recordCast(ability, dealt);
        log.record(ability.getDisplayName(), CombatLog.describe(dealt, roll.miss(), roll.crit(), clearcast), this);
        return CastResult.of(dealt, !roll.miss(), roll.crit(), clearcast);
    }

    /**
     * Resolves a Maul in place of a Bear form auto attack.
     * @param mangleDebuff whether the Mangle debuff is on the target
     * @return the cast result
     */
    public CastResult maul(boolean mangleDebuff) {
        return executeBearSpecial(Ability.MAUL, damage.maulLow(), damage.maulHigh(), MAUL_COST, false, mangleDebuff);
    }

    /**
     * Casts Lacerate. A landed Lacerate reports the single-stack tick damage in
     * {@link CastResult#tickDamage()}.
     * @param mangleDebuff whether the Mangle debuff is on the target
     * @return the cast result
     */
    public CastResult lacerate(boolean mangleDebuff) {
        CastResult result = executeBearSpecial(Ability.LACERATE, damage.lacerateHit(), damage.lacerateHit(),
                LACERATE_COST, true, mangleDebuff);
        if (!result.accepted()) {
            return result;
        }
        return withTick(result, result.landed() ? damage.lacerateTick() : 0.0);
    }

    /**
     * Uses Enrage: 20 rage, a rage trickle and increased bear damage until the next shift.
     */
    public void useEnrage() {
        rage = clamp(rage + Config.ENRAGE_RAGE, 0.0, Config.RAGE_CAP);
        enrage = true;
        enrageCooldown = Config.ENRAGE_COOLDOWN;
        log.record("Enrage", "applied", this);
    }

    // ---------------------------------------------------------------------
    // Shifting
    // ---------------------------------------------------------------------

    /**
     * Shifts between Cat and Bear form. From caster form the shift always goes to Cat form.
     * A powershift re-enters the current form. Shifting costs mana, starts the five-second
     * rule and uses a mana rune when it can be used without waste.
     *
     * @param time       the current simulation time
     * @param powershift whether to re-enter the current form
     */
    public void shift(double time, boolean powershift) {
        boolean toBear = powershift ? form == Form.BEAR : form == Form.CAT;
        String outcome = "";
        Ability ability;

        if (toBear) {
            form = Form.BEAR;
            rage = rng.nextDouble() < 0.2 * config.getFuror() ? 10.0 : 0.0;
            ability = Ability.SHIFT_BEAR;
            if (enrageCooldown < Config.EPSILON) {
                rage += Config.ENRAGE_RAGE;
                enrage = true;
                enrageCooldown = Config.ENRAGE_COOLDOWN;
                outcome = "use Enrage";
            }
        } else {
            form = Form.CAT;
            energy = clamp(Math.min(energy, 20.0 * config.getFuror()) + (config.isWolfshead() ? 20 : 0),
                    0.0, Config.ENERGY_CAP);
            enrage = false;
            ability = Ability.SHIFT_CAT;
        }

        gcd = Config.SHIFT_GCD;
        statistics.recordCast(ability, 0.0);
        mana = Math.max(0.0, mana - shiftCost);
        fiveSecondRule = true;
        lastShift = time;
        readyToShift = false;

        if (useRune()) {
            outcome = "use Dark Rune";
        }
        String name = powershift ? "Powers" + ability.getDisplayName().substring(1) : ability.getDisplayName();
        log.record(name, outcome, this);
    }

    /**
     * Leaves Cat form to cast Gift of the Wild for a chance at a free-cast proc.
     * @param time the current simulation time
     */
    public void flowershift(double time) {
        form = Form.CASTER;
        enrage = false;
        gcd = spellGcd;
        statistics.recordCast(Ability.GIFT_OF_THE_WILD, 0.0);
        mana = Math.max(0.0, mana - Config.GIFT_OF_THE_WILD_COST);
        fiveSecondRule = true;
        lastShift = time;
        readyToGift = false;

        if (config.isOmen() && rng.nextDouble() < omenGiftRate) {
            omenProc = true;
        }
        log.record(Ability.GIFT_OF_THE_WILD.getDisplayName(), omenProc ? "clearcast" : "", this);
    }

    /**
     * Uses a mana rune if it is off cooldown and would not overfill the mana pool.
     * @return true if the rune was used
     */
    public boolean useRune() {
        if (!config.isRune() || runeCooldown > Config.EPSILON
                || mana > stat(StatTarget.MANA_POOL) - Config.RUNE_MANA_DEFICIT) {
            return false;
        }
        addMana(Config.RUNE_MIN_MANA + rng.nextDouble() * Config.RUNE_MANA_RANGE);
        runeCooldown = Config.RUNE_COOLDOWN;
        if (LOG.isTraceEnabled()) {
            LOG.trace("Rune used, mana now {}", mana);
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Time
    // ---------------------------------------------------------------------

    /**
     * Regenerates energy, mana and, while Enrage is up, rage.
     * @param deltaT elapsed time in seconds
     */
    public void regen(double deltaT) {
        energy = clamp(energy + Config.ENERGY_PER_SECOND * deltaT, 0.0, Config.ENERGY_CAP);
        double manaRegen = fiveSecondRule ? fiveSecondRuleRegen : baseRegen;
        addMana(manaRegen * deltaT);
        if (enrage) {
            rage = clamp(rage + Config.ENRAGE_RAGE_PER_SECOND * deltaT, 0.0, Config.RAGE_CAP);
        }
    }

    /**
     * Counts every cooldown down by the elapsed time, never below zero.
     * @param deltaT elapsed time in seconds
     */
    public void tickCooldowns(double deltaT) {
        gcd = Math.max(0.0, gcd - deltaT);
        ilotpCooldown = Math.max(0.0, ilotpCooldown - deltaT);
        runeCooldown = Math.max(0.0, runeCooldown - deltaT);
        tigersFuryCooldown = Math.max(0.0, tigersFuryCooldown - deltaT);
        berserkCooldown = Math.max(0.0, berserkCooldown - deltaT);
        enrageCooldown = Math.max(0.0, enrageCooldown - deltaT);
        mangleCooldown = Math.max(0.0, mangleCooldown - deltaT);
        faerieFireCooldown = Math.max(0.0, faerieFireCooldown - deltaT);
    }

    /**
     * Ends the five-second rule window once five seconds have passed since the last cast.
     * @param time the current simulation time
     */
    public void updateFiveSecondRule(double time) {
        if (fiveSecondRule && time - lastShift >= Config.FIVE_SECOND_RULE) {
            fiveSecondRule = false;
        }
    }

    // ---------------------------------------------------------------------
    // Cooldown buffs toggled by the event loop
    // ---------------------------------------------------------------------

    /**
     * Activates Tiger's Fury: energy, bonus damage and the cooldown.
     */
    public void applyTigersFury() {
        energy = clamp(energy + Config.TIGERS_FURY_ENERGY, 0.0, Config.ENERGY_CAP);
        tigersFuryCooldown = Config.TIGERS_FURY_COOLDOWN;
        setTigersFury(true);
    }

    /**
     * Toggles the Tiger's Fury bonus damage.
     * @param active whether the bonus applies
     */
    public void setTigersFury(boolean active) {
        if (tigersFury != active) {
            tigersFury = active;
            recalculateDamage();
        }
    }

    /**
     * Activates Berserk, halving all cat energy costs.
     * @param prepop whether Berserk was used before the pull, which costs no global cooldown
     */
    public void applyBerserk(boolean prepop) {
        berserk = true;
        updateAbilityCosts();
        gcd = prepop ? 0.0 : Config.CAT_GCD;
        berserkCooldown = Config.BERSERK_COOLDOWN - (prepop ? 1.0 : 0.0);
    }

    /**
     * Ends Berserk and restores normal energy costs.
     */
    public void dropBerserk() {
        berserk = false;
        updateAbilityCosts();
    }

    public void setSavageRoar(boolean active) {
        this.savageRoar = active;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void addMana(double amount) {
        mana = clamp(mana + amount, 0.0, stat(StatTarget.MANA_POOL));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static CastResult withTick(CastResult result, double tick) {
        return new CastResult(result.accepted(), result.damage(), result.landed(), result.crit(),
                result.clearcast(), tick);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public ActorConfig getConfig() { return config; }
    public CastStatistics getStatistics() { return statistics; }
    public List<ProcObserver> getProcObservers() { return Collections.unmodifiableList(procObservers); }
    public DamageParameters getDamage() { return damage; }
    public boolean isTigersFury() { return tigersFury; }

    public double getStat(StatTarget target) { return stat(target); }
    public double getAttackPower() { return stat(StatTarget.ATTACK_POWER); }
    public double getCritChance() { return stat(StatTarget.CRIT_CHANCE); }
    public double getSwingTimer() { return stat(StatTarget.SWING_TIMER); }
    public double getManaPool() { return stat(StatTarget.MANA_POOL); }
    public double getMissChance() { return missChance; }
    public double getDodgeChance() { return dodgeChance; }
    public double getSpellMissChance() { return spellMissChance; }
    public double getRegenFactor() { return regenFactor; }
    public double getShiftCost() { return shiftCost; }
    public double getRipDuration() { return ripDuration; }
    public double getRakeDuration() { return rakeDuration; }

    public Form getForm() { return form; }
    public boolean isCatForm() { return form == Form.CAT; }
    public double getEnergy() { return energy; }
    public double getRage() { return rage; }
    public double getMana() { return mana; }
    public int getComboPoints() { return comboPoints; }
    public double getGcd() { return gcd; }
    public boolean isOmenProc() { return omenProc; }
    public boolean isBerserk() { return berserk; }
    public boolean isEnrage() { return enrage; }
    public boolean isSavageRoar() { return savageRoar; }
    public boolean isFiveSecondRule() { return fiveSecondRule; }
    public double getLastShift() { return lastShift; }

    public double getTigersFuryCooldown() { return tigersFuryCooldown; }
    public double getBerserkCooldown() { return berserkCooldown; }
    public double getEnrageCooldown() { return enrageCooldown; }
    public double getMangleCooldown() { return mangleCooldown; }
    public double getFaerieFireCooldown() { return faerieFireCooldown; }

    public double getShredCost() { return shredCost; }
    public double getRakeCost() { return rakeCost; }
    public double getMangleCost() { return mangleCost; }
    public double getBaseMangleCost() { return baseMangleCost; }
    public double getBiteCost() { return biteCost; }
    public double getRipCost() { return ripCost; }
    public double getBaseRipCost() { return baseRipCost; }
    public double getRoarCost() { return roarCost; }

    public boolean isReadyToShift() { return readyToShift; }
    public void setReadyToShift(boolean readyToShift) { this.readyToShift = readyToShift; }
    public boolean isReadyToGift() { return readyToGift; }
    public void setReadyToGift(boolean readyToGift) { this.readyToGift = readyToGift; }

    /**
     * @param spellGcd the hasted spell global cooldown used by Gift of the Wild
     */
    public void setSpellGcd(double spellGcd) { this.spellGcd = spellGcd; }
    public double getSpellGcd() { return spellGcd; }

    /**
     * Grants energy or rage from an external source such as Revitalize, depending on form.
     * @param energyAmount energy granted in Cat form
     * @param rageAmount rage granted in Bear form
     */
    public void grantResource(double energyAmount, double rageAmount) {
        if (form == Form.CAT) {
            energy = clamp(energy + energyAmount, 0.0, Config.ENERGY_CAP);
        } else if (form == Form.BEAR) {
            rage = clamp(rage + rageAmount, 0.0, Config.RAGE_CAP);
        }
    }

    /**
     * Sets the free-cast proc, used by the pre-pull setup.
     * @param omenProc whether a free cast is pending
     */
    public void setOmenProc(boolean omenProc) { this.omenProc = omenProc; }
}

package org.foxesworld.kalibridge.engine.ai;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;

/**
 * The host's view of one living mob, as far as goals need it: world queries around the mob
 * and movement/look/attack commands. Implemented by the host engine.
 *
 * <p>Entities are referred to by id; {@link #NO_ENTITY} means none.</p>
 */
public interface MobBody {

    long NO_ENTITY = 0L;

    long entityId();

    Random random();

    double x();
    double y();
    double z();
    double eyeHeight();

    boolean isInWater();
    boolean isOnGround();
    boolean isBaby();
    boolean isInLove();

    /** Recently hurt or burning. */
    boolean isPanicking();

    boolean isAlive(long entityId);
    boolean isInLove(long entityId);
    double distanceSqTo(long entityId);
    boolean canSee(long entityId);

    long target();
    void setTarget(long entityId);

    /** Last attacker, or {@link #NO_ENTITY}. */
    long lastHurtBy();

    /** Changes whenever {@link #lastHurtBy()} is set anew. */
    int lastHurtByTimestamp();

    OptionalLong nearestPlayer(double range);
    OptionalLong nearestPlayerHolding(String itemKey, double range);

    /** @param type {@code "player"} or an entity type key */
    OptionalLong nearestEntityOfType(String type, double range, boolean mustSee);

    OptionalLong nearestAdultOfSameType(double range);
    OptionalLong findMate(double range);

    Optional<Position> randomStrollTarget(int horizontalRange, int verticalRange, boolean avoidWater);

    boolean moveTo(Position pos, double speedModifier);
    boolean moveToEntity(long entityId, double speedModifier);
    boolean canPathTo(long entityId);
    boolean isNavigating();
    void stopNavigation();

    void lookAt(long entityId);
    void lookAt(double x, double y, double z);

    void jump();
    void leapTowards(long entityId, double yd);

    boolean isWithinMeleeRange(long entityId);
    boolean doHurtTarget(long entityId);

    void breedWith(long partnerId);

    /** Makes nearby mobs of the same type target {@code attackerId}. */
    void alertOthers(long attackerId);
}

package org.foxesworld.kalibridge.engine.ai.behavior;

/** One entry of a behavior list: a goal kind at a priority. */
public interface BehaviorDescriptor {

    String CUSTOM = "custom";

    String type();

    int priority();
}

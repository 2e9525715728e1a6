package org.econsim.runtime.model;

import org.econsim.runtime.utility.UtilityFunction;

import java.util.Objects;

/**
 * An economic agent on the grid.
 * <p>
 * An agent holds two inventories: the capacity-bounded {@code carrying} bundle it moves around with,
 * and the unbounded {@code home} bundle stored at its home cell. Utility is always evaluated on the
 * total of both. Only the step executor mutates agents, and only while applying actions.
 */
public class Agent {

    private final int id;
    private final Position homePosition;
    private final UtilityFunction utility;
    private final int carryingCapacity;

    private Position position;
    private Bundle carrying;
    private Bundle home;
    private AgentMode mode = AgentMode.IDLE;
    private Position target;
    private Integer partnerId;
    private boolean loggingEnabled = false;

    /**
     * Creates an agent with empty inventories.
     *
     * @param id The unique, immutable agent id.
     * @param position The starting cell.
     * @param homePosition The home cell.
     * @param utility The agent's preferences.
     * @param carryingCapacity Maximum number of units carried; must be positive.
     */
    public Agent(int id, Position position, Position homePosition, UtilityFunction utility, int carryingCapacity) {
        this(id, position, homePosition, utility, carryingCapacity, Bundle.EMPTY, Bundle.EMPTY);
    }

    /**
     * Creates an agent with the given inventories.
     *
     * @param id The unique, immutable agent id.
     * @param position The starting cell.
     * @param homePosition The home cell.
     * @param utility The agent's preferences.
     * @param carryingCapacity Maximum number of units carried; must be positive.
     * @param carrying The initial carrying inventory.
     * @param home The initial home inventory.
     * @throws IllegalArgumentException if the capacity is not positive or {@code carrying} exceeds it.
     */
    public Agent(int id, Position position, Position homePosition, UtilityFunction utility, int carryingCapacity,
                 Bundle carrying, Bundle home) {
        if (carryingCapacity <= 0) {
            throw new IllegalArgumentException("Carrying capacity must be positive, got " + carryingCapacity);
        }
        this.id = id;
        this.position = Objects.requireNonNull(position, "position");
        this.homePosition = Objects.requireNonNull(homePosition, "homePosition");
        this.utility = Objects.requireNonNull(utility, "utility");
        this.carryingCapacity = carryingCapacity;
        this.carrying = Objects.requireNonNull(carrying, "carrying");
        this.home = Objects.requireNonNull(home, "home");
        if (carrying.total() > carryingCapacity) {
            throw new IllegalArgumentException("Agent " + id + " carrying " + carrying + " exceeds capacity " + carryingCapacity);
        }
    }

    /**
     * Returns carrying plus home. Computed on every call.
     * @return The total bundle the agent owns.
     */
    public Bundle totalBundle() {
        return carrying.plus(home);
    }

    public double currentUtility() {
        return utility.value(totalBundle());
    }

    public boolean isAtHome() {
        return position.equals(homePosition);
    }

    public boolean isCarryingFull() {
        return carrying.total() >= carryingCapacity;
    }

    public int freeCapacity() {
        return carryingCapacity - carrying.total();
    }

    /**
     * Moves units of one good from the carrying inventory to the home inventory.
     *
     * @param good The good to deposit.
     * @param amount Number of units, must be positive.
     * @throws IllegalArgumentException if {@code amount} is not positive.
     * @throws IllegalStateException if the agent is not at home or carries fewer units.
     */
    public void depositToHome(Good good, int amount) {
        requirePositive(amount);
        if (!isAtHome()) {
            throw new IllegalStateException("Agent " + id + " cannot deposit - not at home");
        }
        if (carrying.get(good) < amount) {
            throw new IllegalStateException("Agent " + id + " cannot deposit " + amount + " " + good + " - only carrying " + carrying.get(good));
        }
        carrying = carrying.minus(good, amount);
        home = home.plus(good, amount);
    }

    /**
     * Moves units of one good from the home inventory to the carrying inventory.
     *
     * @param good The good to withdraw.
     * @param amount Number of units, must be positive.
     * @throws IllegalArgumentException if {@code amount} is not positive.
     * @throws IllegalStateException if the agent is not at home, has fewer units stored,
     *                               or the withdrawal would exceed the carrying capacity.
     */
    public void withdrawFromHome(Good good, int amount) {
        requirePositive(amount);
        if (!isAtHome()) {
            throw new IllegalStateException("Agent " + id + " cannot withdraw - not at home");
        }
        if (home.get(good) < amount) {
            throw new IllegalStateException("Agent " + id + " cannot withdraw " + amount + " " + good + " - only have " + home.get(good) + " at home");
        }
        if (amount > freeCapacity()) {
            throw new IllegalStateException("Agent " + id + " cannot withdraw " + amount + " " + good + " - free capacity is " + freeCapacity());
        }
        home = home.minus(good, amount);
        carrying = carrying.plus(good, amount);
    }

    /**
     * Adds one collected unit to the carrying inventory.
     * @param good The collected good.
     * @throws IllegalStateException if the carrying inventory is full.
     */
    public void collect(Good good) {
        if (isCarryingFull()) {
            throw new IllegalStateException("Agent " + id + " cannot collect - carrying inventory full");
        }
        carrying = carrying.plus(good, 1);
    }

    /**
     * Hands over one unit of {@code gives} and takes one unit of {@code receives}, in the carrying inventory.
     * @param gives The good given away.
     * @param receives The good received.
     * @throws IllegalStateException if no unit of {@code gives} is carried.
     */
    public void exchange(Good gives, Good receives) {
        if (carrying.get(gives) < 1) {
            throw new IllegalStateException("Agent " + id + " cannot give " + gives + " - none carried");
        }
        carrying = carrying.swap(gives, receives);
    }

    /**
     * Checks the invariants the engine relies on.
     * @throws IllegalStateException if the agent is malformed.
     */
    public void validate() {
        if (carrying.total() > carryingCapacity) {
            throw new IllegalStateException("Agent " + id + " carrying " + carrying + " exceeds capacity " + carryingCapacity);
        }
        if (partnerId != null && partnerId == id) {
            throw new IllegalStateException("Agent " + id + " is paired with itself");
        }
    }

    private static void requirePositive(int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }

    public int getId() { return id; }

    public Position getPosition() { return position; }

    public void moveTo(Position position) { this.position = Objects.requireNonNull(position, "position"); }

    public Position getHomePosition() { return homePosition; }

    public UtilityFunction getUtility() { return utility; }

    public int getCarryingCapacity() { return carryingCapacity; }

    public Bundle getCarrying() { return carrying; }

    public Bundle getHome() { return home; }

    public AgentMode getMode() { return mode; }

    public void setMode(AgentMode mode) { this.mode = Objects.requireNonNull(mode, "mode"); }

    /**
     * Returns the cell the agent is heading for, or {@code null}.
     * @return The current target cell.
     */
    public Position getTarget() { return target; }

    public void setTarget(Position target) { this.target = target; }

    /**
     * Returns the id of the trading partner, or {@code null} when unpaired.
     * @return The partner id.
     */
    public Integer getPartnerId() { return partnerId; }

    public boolean hasPartner() { return partnerId != null; }

    public void setPartnerId(Integer partnerId) { this.partnerId = partnerId; }

    public boolean isLoggingEnabled() { return loggingEnabled; }

    public void setLoggingEnabled(boolean loggingEnabled) { this.loggingEnabled = loggingEnabled; }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", pos=" + position + ", carrying=" + carrying + ", home=" + home
                + ", mode=" + mode + ", partner=" + partnerId + "}";
    }
}

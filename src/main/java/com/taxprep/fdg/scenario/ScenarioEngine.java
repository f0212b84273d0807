package com.taxprep.fdg.scenario;

import com.taxprep.fdg.model.ValidatedInformation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the scenarios of one base input and their cached results.
 *
 * <p>
 * Each calculation applies the scenario's modifications to the base in order
 * and runs a fresh graph over the derived input; the base is never mutated.
 * Results are cached per scenario id until an edit invalidates them, as
 * decided by {@link ScenarioEvent}.
 *
 * <p>
 * Thread-safe. Calculations and edits of the same scenario serialize on that
 * scenario's lock; different scenarios proceed independently. Caller errors
 * (unknown id, modification that does not apply) raise
 * {@link IllegalArgumentException} before any state changes.
 */
@Log4j2
public final class ScenarioEngine {
    public static final String BASELINE_ID = "baseline";

    private final ValidatedInformation base;
    private final ScenarioCalculator calculator;
    private final ScenarioSelection selection;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, TaxCalculationResult> results = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final Object baselineLock = new Object();
    private volatile TaxCalculationResult baseline;

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        final long seq;
        volatile Scenario scenario;
        volatile ScenarioState state = ScenarioState.DRAFT;

        Entry(long seq, Scenario scenario) {
            this.seq = seq;
            this.scenario = scenario;
        }
    }

    public ScenarioEngine(ValidatedInformation base, ScenarioCalculator calculator) {
        this(base, calculator, ScenarioSelection.DEFAULT_LIMIT);
    }

    public ScenarioEngine(ValidatedInformation base, ScenarioCalculator calculator, int selectionLimit) {
        if (base == null)
            throw new IllegalArgumentException("base information is required");
        this.base = base;
        this.calculator = calculator;
        this.selection = new ScenarioSelection(selectionLimit);
    }

    public ValidatedInformation baseInformation() {
        return base;
    }

    // ── Scenario lifecycle ──────────────────────────────────────

    public Scenario create(String name, String description) {
        Scenario s = Scenario.create(name, description);
        register(s);
        log.info("Created scenario {} '{}'", s.id(), s.name());
        return s;
    }

    /** Creates a scenario pre-filled with a quick scenario's modifications. */
    public Scenario create(QuickScenario quick) {
        Scenario s = Scenario.create(quick.name(), quick.description()).withModifications(quick.modifications());
        ModificationApplier.apply(base, s.modifications());
        register(s);
        log.info("Created scenario {} from quick scenario '{}'", s.id(), quick.name());
        return s;
    }

    public Scenario updateMetadata(String id, String name, String description) {
        return withEntry(id, e -> {
            e.scenario = e.scenario.withMetadata(name, description);
            transition(e, ScenarioEvent.METADATA_UPDATED);
            return e.scenario;
        });
    }

    public Scenario addModification(String id, Modification modification) {
        return withEntry(id, e -> {
            Scenario candidate = e.scenario.plus(modification);
            ModificationApplier.apply(base, candidate.modifications());
            e.scenario = candidate;
            transition(e, ScenarioEvent.MODIFICATION_ADDED);
            return candidate;
        });
    }

    /** Replaces the modification with the same id. */
    public Scenario updateModification(String id, Modification modification) {
        return withEntry(id, e -> {
            List<Modification> mods = new ArrayList<>(e.scenario.modifications());
            int at = indexOf(mods, modification.id());
            if (at < 0)
                throw new IllegalArgumentException("Unknown modification " + modification.id() + " in " + id);
            mods.set(at, modification);
            ModificationApplier.apply(base, mods);
            e.scenario = e.scenario.withModifications(mods);
            transition(e, ScenarioEvent.MODIFICATION_UPDATED);
            return e.scenario;
        });
    }

    public Scenario removeModification(String id, String modificationId) {
        return withEntry(id, e -> {
            List<Modification> mods = new ArrayList<>(e.scenario.modifications());
            int at = indexOf(mods, modificationId);
            if (at < 0)
                throw new IllegalArgumentException("Unknown modification " + modificationId + " in " + id);
            mods.remove(at);
            ModificationApplier.apply(base, mods);
            e.scenario = e.scenario.withModifications(mods);
            transition(e, ScenarioEvent.MODIFICATION_REMOVED);
            return e.scenario;
        });
    }

    public Scenario clearModifications(String id) {
        return withEntry(id, e -> {
            e.scenario = e.scenario.withModifications(List.of());
            transition(e, ScenarioEvent.MODIFICATIONS_CLEARED);
            return e.scenario;
        });
    }

    /** Removes the scenario, its cached result and its selection. */
    public void delete(String id) {
        withEntry(id, e -> {
            transition(e, ScenarioEvent.DELETED);
            entries.remove(id);
            selection.deselect(id);
            return null;
        });
        log.info("Deleted scenario {}", id);
    }

    /** Copies a scenario's modifications into a new draft scenario. */
    public Scenario duplicate(String id, String newName) {
        Scenario source = scenario(id);
        Scenario copy = source.copyAs(newName == null ? source.name() + " (copy)" : newName);
        register(copy);
        log.info("Duplicated scenario {} as {}", id, copy.id());
        return copy;
    }

    /**
     * Appends scenarios, as drafts, after the existing ones. Nothing is added
     * unless every scenario is new and applies cleanly.
     */
    public List<Scenario> importScenarios(List<Scenario> scenarios) {
        Set<String> ids = new HashSet<>();
        for (Scenario s : scenarios) {
            if (entries.containsKey(s.id()) || !ids.add(s.id()))
                throw new IllegalArgumentException("Duplicate scenario id on import: " + s.id());
            ModificationApplier.apply(base, s.modifications());
        }
        for (Scenario s : scenarios)
            register(s);
        log.info("Imported {} scenarios", scenarios.size());
        return List.copyOf(scenarios);
    }

    /** Every scenario in creation order. */
    public List<Scenario> exportScenarios() {
        return scenarios();
    }

    /** Removes every scenario, cached result and selection. */
    public void clearAll() {
        for (String id : new ArrayList<>(entries.keySet())) {
            Entry e = entries.get(id);
            if (e == null)
                continue;
            e.lock.lock();
            try {
                if (e.state != ScenarioState.DELETED)
                    transition(e, ScenarioEvent.DELETED);
                entries.remove(id);
                selection.deselect(id);
            } finally {
                e.lock.unlock();
            }
        }
        results.clear();
        selection.clear();
        log.info("Cleared all scenarios");
    }

    // ── Queries ─────────────────────────────────────────────────

    public Scenario scenario(String id) {
        return entry(id).scenario;
    }

    public List<Scenario> scenarios() {
        return entries.values().stream()
                .sorted(Comparator.comparingLong(e -> e.seq))
                .map(e -> e.scenario)
                .toList();
    }

    public ScenarioState state(String id) {
        return entry(id).state;
    }

    public Optional<TaxCalculationResult> cachedResult(String id) {
        entry(id);
        return Optional.ofNullable(results.get(id));
    }

    /** The base input with the scenario's modifications applied. */
    public ValidatedInformation derivedInformation(String id) {
        return ModificationApplier.apply(base, scenario(id).modifications());
    }

    // ── Calculation ─────────────────────────────────────────────

    public TaxCalculationResult calculate(String id) {
        return withEntry(id, e -> {
            Scenario s = e.scenario;
            ValidatedInformation derived = ModificationApplier.apply(base, s.modifications());
            TaxCalculationResult result = calculator.calculate(s.id(), s.name(), false, derived);
            results.put(id, result);
            transition(e, ScenarioEvent.CALCULATED);
            return result;
        });
    }

    /** Result for the unmodified base input, calculated once. */
    public TaxCalculationResult baseline() {
        TaxCalculationResult b = baseline;
        if (b != null)
            return b;
        synchronized (baselineLock) {
            if (baseline == null)
                baseline = calculator.calculate(BASELINE_ID, "Baseline", true, base);
            return baseline;
        }
    }

    /** Compares each scenario with the baseline, calculating those without a cached result. */
    public ScenarioComparison compare(List<String> ids) {
        TaxCalculationResult b = baseline();
        List<ScenarioDifference> diffs = new ArrayList<>(ids.size());
        for (String id : ids) {
            TaxCalculationResult r = cachedResult(id).orElseGet(() -> calculate(id));
            diffs.add(ScenarioDifference.between(b, r));
        }
        return new ScenarioComparison(b, diffs);
    }

    public ScenarioComparison compareSelected() {
        return compare(selection.selected());
    }

    // ── Selection ───────────────────────────────────────────────

    /**
     * Selects a scenario for comparison, evicting the first-selected one when
     * the selection is full.
     */
    public void select(String id) {
        String evicted = withEntry(id, e -> selection.select(id));
        if (evicted != null)
            log.debug("Selection full, evicted {}", evicted);
    }

    public void deselect(String id) {
        selection.deselect(id);
    }

    public List<String> selected() {
        return selection.selected();
    }

    public int selectionLimit() {
        return selection.limit();
    }

    // ── Internals ───────────────────────────────────────────────

    private void register(Scenario s) {
        if (entries.putIfAbsent(s.id(), new Entry(sequence.incrementAndGet(), s)) != null)
            throw new IllegalArgumentException("Scenario id already exists: " + s.id());
    }

    private Entry entry(String id) {
        Entry e = id == null ? null : entries.get(id);
        if (e == null)
            throw new IllegalArgumentException("Unknown scenario: " + id);
        return e;
    }

    private <R> R withEntry(String id, Function<Entry, R> action) {
        Entry e = entry(id);
        e.lock.lock();
        try {
            if (e.state == ScenarioState.DELETED)
                throw new IllegalArgumentException("Unknown scenario: " + id);
            return action.apply(e);
        } finally {
            e.lock.unlock();
        }
    }

    private void transition(Entry e, ScenarioEvent event) {
        ScenarioState from = e.state;
        e.state = event.next(from);
        if (event.invalidatesResult())
            results.remove(e.scenario.id());
        log.debug("Scenario {} {}: {} -> {}", e.scenario.id(), event, from, e.state);
    }

    private static int indexOf(List<Modification> mods, String modificationId) {
        for (int i = 0; i < mods.size(); i++)
            if (mods.get(i).id().equals(modificationId))
                return i;
        return -1;
    }
}

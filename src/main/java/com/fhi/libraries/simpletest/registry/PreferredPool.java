package com.fhi.libraries.simpletest.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import lombok.Value;

/**
 * Append-only pool of "preferred" objects.
 *
 * <p>Every object is added together with the explicit set of capability tags it satisfies. Lookups walk the
 * pool from the most recently added entry to the oldest and return the first one declaring any of the requested
 * tags. Tags are compared for equality only, the type hierarchy of the pooled object is not consulted.</p>
 *
 * <p>The entries are held as one immutable list that is swapped on every change, so a lookup always sees either
 * the pool before or after an {@link #add} or {@link #reset}, never a half-filled one.</p>
 */
public class PreferredPool
{
    private final AtomicReference<List<Entry>> entries = new AtomicReference<>(List.of());


    public void add(Object object, Set<Class<?>> capabilities)
    {   Entry entry = new Entry(object, Set.copyOf(capabilities));
        entries.updateAndGet(current -> append(current, entry));
    }

    /**
     * @return the most recently added object declaring any of the given capabilities, or empty
     */
    public Optional<Object> findAny(Collection<? extends Class<?>> capabilities)
    {
        List<Entry> snapshot = entries.get();
        for (int i = snapshot.size() - 1; i >= 0; i--)
        {   Entry entry = snapshot.get(i);
            for (Class<?> capability : capabilities)
            {   if (entry.getCapabilities().contains(capability)) {
                    return Optional.of(entry.getObject());
                }
            }
        }
        return Optional.empty();
    }

    public List<Entry> entries()
    {   return entries.get();
    }

    public int size()
    {   return entries.get().size();
    }

    /**
     * Replaces the whole pool in one step.
     */
    void reset(List<Entry> replacement)
    {   entries.set(List.copyOf(replacement));
    }


    private static List<Entry> append(List<Entry> current, Entry entry)
    {   List<Entry> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(entry);
        return Collections.unmodifiableList(next);
    }


    @Value
    public static class Entry
    {
        Object object;

        Set<Class<?>> capabilities;
    }
}

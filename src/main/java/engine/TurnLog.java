package engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Entries produced while one turn resolves. Handed through the turn's calls by reference. */
public final class TurnLog {
    private final List<String> entries = new ArrayList<>();

    public void add(String line) { entries.add(line); }

    public void addf(String format, Object... args) { entries.add(String.format(java.util.Locale.ROOT, format, args)); }

    public List<String> entries() { return Collections.unmodifiableList(entries); }

    public boolean isEmpty() { return entries.isEmpty(); }
}

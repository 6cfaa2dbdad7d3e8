package com.netconfig.parser.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import com.netconfig.parser.address.AddressExtractor;
import com.netconfig.parser.address.AddressRecord;
import com.netconfig.parser.exception.InvalidQueryException;

import lombok.Getter;
import lombok.NonNull;

/**
 * One line of a configuration document together with its place in the tree.
 *
 * A parent owns its ordered children; the child keeps a back-reference to the
 * parent for upward navigation only. Lines are linked by a parser during a
 * single pass and sealed when the pass completes. After sealing the tree is
 * read-only and derived traversals are memoized.
 */
public class ConfigLine {

    @Getter
    private final int lineNumber;

    @Getter
    private final String text;

    private ConfigLine parent;
    private final List<ConfigLine> children = new ArrayList<>();
    private volatile boolean sealed;

    private volatile List<ConfigLine> ancestorCache;
    private volatile List<ConfigLine> descendantCache;
    private volatile AddressRecord addressRecord;

    public ConfigLine(int lineNumber, @NonNull String text) {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line numbers start at 1, got " + lineNumber);
        }
        this.lineNumber = lineNumber;
        this.text = text;
    }

    /**
     * Append a child. Only parsers call this, and only before {@link #seal()}.
     */
    public void addChild(@NonNull ConfigLine child) {
        if (sealed) {
            throw new IllegalStateException("Line " + lineNumber + " is sealed; children cannot be added");
        }
        if (child == this || child.parent != null) {
            throw new IllegalStateException("Line " + child.lineNumber + " already has a parent");
        }
        children.add(child);
        child.parent = this;
    }

    /**
     * Freeze the children list. Called by the parser once the whole document is linked.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * The parent line, or {@code null} for a root.
     */
    public ConfigLine getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public List<ConfigLine> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 1 for a root, parent's generation + 1 otherwise.
     */
    public int getGeneration() {
        int generation = 1;
        for (ConfigLine p = parent; p != null; p = p.parent) {
            generation++;
        }
        return generation;
    }

    /**
     * Ancestors ordered from the root down to the immediate parent.
     */
    public List<ConfigLine> getAncestors() {
        List<ConfigLine> cached = ancestorCache;
        if (cached != null) {
            return cached;
        }
        List<ConfigLine> ancestors = new ArrayList<>();
        for (ConfigLine p = parent; p != null; p = p.parent) {
            ancestors.add(p);
        }
        Collections.reverse(ancestors);
        List<ConfigLine> result = Collections.unmodifiableList(ancestors);
        if (sealed) {
            ancestorCache = result;
        }
        return result;
    }

    /**
     * All descendants in pre-order, which is also document order.
     */
    public List<ConfigLine> getDescendants() {
        List<ConfigLine> cached = descendantCache;
        if (cached != null) {
            return cached;
        }
        List<ConfigLine> descendants = new ArrayList<>();
        Deque<ConfigLine> pending = new ArrayDeque<>();
        pushChildrenReversed(this, pending);
        while (!pending.isEmpty()) {
            ConfigLine next = pending.pop();
            descendants.add(next);
            pushChildrenReversed(next, pending);
        }
        List<ConfigLine> result = Collections.unmodifiableList(descendants);
        if (sealed) {
            descendantCache = result;
        }
        return result;
    }

    private static void pushChildrenReversed(ConfigLine line, Deque<ConfigLine> pending) {
        for (int i = line.children.size() - 1; i >= 0; i--) {
            pending.push(line.children.get(i));
        }
    }

    /**
     * Ancestors, this line and all descendants.
     */
    public List<ConfigLine> family() {
        return family(FamilyOptions.DEFAULTS);
    }

    /**
     * Build a family list for this line.
     *
     * @throws InvalidQueryException for a negative cousin depth, for both cousin options at once,
     *                               or when no ancestor satisfies {@code cousinUntil}
     */
    public List<ConfigLine> family(@NonNull FamilyOptions options) {
        ConfigLine subject = this;
        boolean allDescendants = options.isIncludeAllDescendants() || options.hasCousinOption();

        if (options.getCousinDepth() != null && options.getCousinUntil() != null) {
            throw new InvalidQueryException("cousinDepth and cousinUntil cannot be combined");
        }
        if (options.getCousinDepth() != null) {
            int depth = options.getCousinDepth();
            if (depth < 0) {
                throw new InvalidQueryException("cousinDepth must be zero or more, got " + depth);
            }
            for (int i = 0; i < depth && subject.parent != null; i++) {
                subject = subject.parent;
            }
        } else if (options.getCousinUntil() != null) {
            subject = climbUntil(options.getCousinUntil());
        }

        List<ConfigLine> family = new ArrayList<>();
        if (options.isIncludeAncestors()) {
            family.addAll(subject.getAncestors());
        }
        if (options.isIncludeSelf()) {
            family.add(subject);
        }
        if (allDescendants) {
            family.addAll(subject.getDescendants());
        } else if (options.isIncludeChildren()) {
            family.addAll(subject.children);
        }
        return family;
    }

    private ConfigLine climbUntil(Predicate<ConfigLine> until) {
        for (ConfigLine current = this; current != null; current = current.parent) {
            if (until.test(current)) {
                return current;
            }
        }
        throw new InvalidQueryException("No ancestor of line " + lineNumber + " satisfies predicate");
    }

    public String getTrimmedText() {
        return text.strip();
    }

    public int getLeadingSpaces() {
        return LineText.leadingSpaces(text);
    }

    public boolean contains(CharSequence fragment) {
        return text.contains(fragment);
    }

    public boolean startsWith(String prefix) {
        return text.startsWith(prefix);
    }

    /**
     * True if the pattern is found anywhere in the text.
     */
    public boolean matches(Pattern pattern) {
        return pattern.matcher(text).find();
    }

    /**
     * Addresses and networks embedded in the text, extracted on first access.
     */
    public AddressRecord getAddresses() {
        AddressRecord record = addressRecord;
        if (record == null) {
            record = AddressExtractor.extract(text);
            addressRecord = record;
        }
        return record;
    }

    /**
     * @see AddressRecord#hasAddress(Object)
     */
    public boolean hasAddress(Object query) {
        return getAddresses().hasAddress(query);
    }

    @Override
    public String toString() {
        return "<ConfigLine gen=" + getGeneration() + " children=" + children.size()
                + " line=" + lineNumber + ": \"" + text + "\">";
    }
}

package work.lcod.minsub.errors;

import java.util.List;

/**
 * Two or more job parameters share a name. Always reports every duplicated
 * name so all conflicts can be fixed at once.
 */
public final class CollisionException extends MinsubException {
    private final List<String> duplicates;

    public CollisionException(List<String> duplicates) {
        super("duplicate_names", "Bad job config; duplicate names found: " + duplicates);
        this.duplicates = List.copyOf(duplicates);
    }

    public List<String> duplicates() {
        return duplicates;
    }
}

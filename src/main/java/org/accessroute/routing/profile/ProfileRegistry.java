package org.accessroute.routing.profile;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of mobility profiles keyed by lower-case name.
 */
public final class ProfileRegistry {
    private final Map<String, MobilityProfile> profilesByName;

    /**
     * Creates a registry with built-in profiles only.
     */
    public ProfileRegistry() {
        this.profilesByName = materialize(BuiltInProfiles.all());
    }

    /**
     * Creates a registry by merging built-ins with custom profiles.
     *
     * <p>Custom profile names override built-ins when names collide.</p>
     */
    public ProfileRegistry(Collection<MobilityProfile> customProfiles) {
        this(customProfiles, true);
    }

    /**
     * Creates an explicit registry from provided profiles.
     */
    public ProfileRegistry(Collection<MobilityProfile> profiles, boolean includeBuiltIns) {
        Collection<MobilityProfile> source = includeBuiltIns ? mergeWithBuiltIns(profiles) : profiles;
        this.profilesByName = materialize(source);
    }

    /**
     * Returns profile by name (case-insensitive), or {@code null} when not registered.
     */
    public MobilityProfile profile(String name) {
        if (name == null) {
            return null;
        }
        return profilesByName.get(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Returns registered profile names in registration order.
     */
    public Set<String> profileNames() {
        return profilesByName.keySet();
    }

    /**
     * Returns registered profiles in registration order.
     */
    public List<MobilityProfile> profiles() {
        return List.copyOf(profilesByName.values());
    }

    public int size() {
        return profilesByName.size();
    }

    /**
     * Returns a new default registry instance.
     */
    public static ProfileRegistry defaultRegistry() {
        return new ProfileRegistry();
    }

    private static Collection<MobilityProfile> mergeWithBuiltIns(Collection<MobilityProfile> customProfiles) {
        LinkedHashMap<String, MobilityProfile> merged = new LinkedHashMap<>();
        for (MobilityProfile profile : BuiltInProfiles.all()) {
            merged.put(profile.name(), profile);
        }
        if (customProfiles != null) {
            for (MobilityProfile profile : customProfiles) {
                MobilityProfile nonNullProfile = Objects.requireNonNull(profile, "profile");
                merged.put(nonNullProfile.name(), nonNullProfile);
            }
        }
        return merged.values();
    }

    private static Map<String, MobilityProfile> materialize(Collection<MobilityProfile> profiles) {
        Objects.requireNonNull(profiles, "profiles");
        LinkedHashMap<String, MobilityProfile> map = new LinkedHashMap<>();
        for (MobilityProfile profile : profiles) {
            MobilityProfile nonNullProfile = Objects.requireNonNull(profile, "profile");
            map.put(nonNullProfile.name(), nonNullProfile);
        }
        return Collections.unmodifiableMap(map);
    }
}

package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ビルダー名からビルダーを引く。起動時に一度だけ登録し、その後は読み取り専用。
 */
public final class FeatureBuilderRegistry {

    private final Map<String, FeatureBuilder> builders = Collections.synchronizedMap(new LinkedHashMap<>());

    public FeatureBuilderRegistry() {
    }

    /** Registry holding the twelve domain builders shipped with the runtime. */
    public static FeatureBuilderRegistry withDefaults() {
        FeatureBuilderRegistry registry = new FeatureBuilderRegistry();
        defaultBuilders().forEach(registry::register);
        return registry;
    }

    public static List<FeatureBuilder> defaultBuilders() {
        return List.of(
                new EducationFeatureBuilder(),
                new RetailFeatureBuilder(),
                new TravelFeatureBuilder(),
                new HealthFeatureBuilder(),
                new FinanceFeatureBuilder(),
                new HospitalityFeatureBuilder(),
                new LogisticsFeatureBuilder(),
                new ManufacturingFeatureBuilder(),
                new AgricultureFeatureBuilder(),
                new EnergyFeatureBuilder(),
                new SecurityFeatureBuilder(),
                new EntertainmentFeatureBuilder());
    }

    public void register(FeatureBuilder builder) {
        Objects.requireNonNull(builder, "builder");
        builders.put(builder.name(), builder);
    }

    public Optional<FeatureBuilder> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(builders.get(name));
    }

    public Set<String> names() {
        synchronized (builders) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(builders.keySet()));
        }
    }

    public List<FeatureBuilder> all() {
        synchronized (builders) {
            return List.copyOf(builders.values());
        }
    }
}

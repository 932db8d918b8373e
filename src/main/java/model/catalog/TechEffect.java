package model.catalog;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import model.ResourceKey;
import model.StatKey;

/** One typed consequence of unlocking a tech node. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TechEffect.Capability.class, name = "capability"),
        @JsonSubTypes.Type(value = TechEffect.Safety.class,     name = "safety"),
        @JsonSubTypes.Type(value = TechEffect.Resource.class,   name = "resource"),
        @JsonSubTypes.Type(value = TechEffect.Stat.class,       name = "stat"),
        @JsonSubTypes.Type(value = TechEffect.UnlockAgi.class,  name = "unlockAgi"),
})
public interface TechEffect {

    record Capability(double delta) implements TechEffect { }

    record Safety(double delta) implements TechEffect { }

    record Resource(ResourceKey key, double delta) implements TechEffect { }

    record Stat(StatKey key, double delta) implements TechEffect { }

    record UnlockAgi() implements TechEffect { }
}

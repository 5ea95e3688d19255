package alpha.simplrouter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

import static alpha.simplrouter.Config.requireValidPrefix;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final String  prefix;
    private final boolean strictRequisites;
    private final String  notFoundPattern;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder          = b;
        prefix           = s.prefix;
        strictRequisites = s.strictRequisites;
        notFoundPattern  = s.notFoundPattern;
    }
    
    @Override
    public String prefix() {
        return prefix;
    }
    
    @Override
    public boolean strictRequisites() {
        return strictRequisites;
    }
    
    @Override
    public String notFoundPattern() {
        return notFoundPattern;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "prefix=\"" + prefix + '"' +
                ", strictRequisites=" + strictRequisites +
                ", notFoundPattern=\"" + notFoundPattern + "\"}";
    }
    
    /**
     * A builder that links back to its predecessor and remembers only one
     * change. {@link #build()} replays the chain, oldest change first, against
     * fresh defaults, so a builder can be shared and branched freely.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder(null, null);
        
        static class MutableState {
            String  prefix           = "";
            boolean strictRequisites = false;
            String  notFoundPattern  = "404";
        }
        
        private final DefaultBuilder prev;
        private final Consumer<MutableState> change;
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> change) {
            this.prev = prev;
            this.change = change;
        }
        
        @Override
        public Builder prefix(String newVal) {
            requireValidPrefix(newVal);
            return new DefaultBuilder(this, s -> s.prefix = newVal);
        }
        
        @Override
        public Builder strictRequisites(boolean newVal) {
            return new DefaultBuilder(this, s -> s.strictRequisites = newVal);
        }
        
        @Override
        public Builder notFoundPattern(String newVal) {
            if (requireNonNull(newVal).isEmpty()) {
                throw new IllegalArgumentException("Not-found pattern is empty.");
            }
            if (newVal.startsWith("/")) {
                throw new IllegalArgumentException(
                    "Not-found pattern can not start with a forward slash (\"/\"). Input was: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.notFoundPattern = newVal);
        }
        
        @Override
        public Config build() {
            Deque<Consumer<MutableState>> changes = new ArrayDeque<>();
            for (DefaultBuilder b = this; b.change != null; b = b.prev) {
                changes.push(b.change);
            }
            MutableState s = new MutableState();
            changes.forEach(c -> c.accept(s));
            return new DefaultConfig(this, s);
        }
    }
}

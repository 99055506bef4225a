package work.cacm.engine.skill;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SkillService} backed by functions registered in process, keyed by plugin then function name.
 */
public final class InMemorySkillService implements SkillService {
    private static final Logger log = LoggerFactory.getLogger(InMemorySkillService.class);

    private final Map<String, Map<String, SkillFunction>> plugins = new ConcurrentHashMap<>();

    public InMemorySkillService register(String pluginName, String functionName, SkillFunction function) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(function, "function");
        plugins.computeIfAbsent(pluginName, key -> new ConcurrentHashMap<>()).put(functionName, function);
        log.info("Registered skill {}.{}", pluginName, functionName);
        return this;
    }

    @Override
    public Object invoke(String pluginName, String functionName, Map<String, Object> arguments) {
        var plugin = plugins.get(pluginName);
        if (plugin == null) {
            throw new SkillInvocationException("Plugin not found: " + pluginName);
        }
        var function = plugin.get(functionName);
        if (function == null) {
            throw new SkillInvocationException("Function '" + functionName + "' not found in plugin " + pluginName);
        }
        var args = arguments == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(arguments);
        try {
            return function.invoke(args);
        } catch (SkillInvocationException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SkillInvocationException("Skill " + pluginName + "." + functionName + " interrupted", ex);
        } catch (Exception ex) {
            throw new SkillInvocationException("Skill " + pluginName + "." + functionName + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean hasFunction(String pluginName, String functionName) {
        var plugin = plugins.get(pluginName);
        return plugin != null && plugin.containsKey(functionName);
    }

    public List<String> qualifiedNames() {
        return plugins.entrySet().stream()
            .flatMap(plugin -> plugin.getValue().keySet().stream().map(fn -> plugin.getKey() + "." + fn))
            .sorted()
            .toList();
    }
}

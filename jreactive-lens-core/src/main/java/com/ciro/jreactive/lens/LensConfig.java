package com.ciro.jreactive.lens;

import com.ciro.jreactive.lens.extract.VariableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuración del análisis. Se lee del recurso {@code jreactive-lens.properties}
 * con prefijo {@code jreactive.lens.}; si no existe se usan los valores por defecto.
 */
public class LensConfig {

    private static final Logger log = LoggerFactory.getLogger(LensConfig.class);

    public static final String RESOURCE = "jreactive-lens.properties";
    public static final String PREFIX = "jreactive.lens.";

    /** Hooks que declaran estado con la forma {@code const [v, setV] = hook(init)} */
    private List<String> stateHooks = new ArrayList<>(VariableExtractor.DEFAULT_STATE_HOOKS);
    /** Caracteres previos en los que un '[' descarta un derivado */
    private int destructuringLookbehind = VariableExtractor.DEFAULT_LOOKBEHIND;
    private boolean rawTextDetection = true;
    private boolean semanticDetection = true;
    /** Patrones por debajo de este umbral no se reportan */
    private double minConfidence = 0.0;

    public List<String> getStateHooks() { return stateHooks; }
    public void setStateHooks(List<String> stateHooks) { this.stateHooks = new ArrayList<>(stateHooks); }

    public int getDestructuringLookbehind() { return destructuringLookbehind; }
    public void setDestructuringLookbehind(int destructuringLookbehind) { this.destructuringLookbehind = destructuringLookbehind; }

    public boolean isRawTextDetection() { return rawTextDetection; }
    public void setRawTextDetection(boolean rawTextDetection) { this.rawTextDetection = rawTextDetection; }

    public boolean isSemanticDetection() { return semanticDetection; }
    public void setSemanticDetection(boolean semanticDetection) { this.semanticDetection = semanticDetection; }

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

    public VariableExtractor newExtractor() {
        return new VariableExtractor(stateHooks, destructuringLookbehind);
    }

    public static LensConfig defaults() {
        return new LensConfig();
    }

    /** Carga {@value #RESOURCE} desde el classpath del hilo actual. */
    public static LensConfig load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = LensConfig.class.getClassLoader();
        return load(cl, RESOURCE);
    }

    public static LensConfig load(ClassLoader classLoader, String resource) {
        LensConfig config = new LensConfig();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", resource);
                return config;
            }
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", resource, e.getMessage());
            return new LensConfig();
        }
        return config;
    }

    /** Aplica las claves presentes; las ausentes o inválidas conservan su valor. */
    public LensConfig apply(Properties props) {
        String hooks = props.getProperty(PREFIX + "state-hooks");
        if (hooks != null) {
            List<String> names = new ArrayList<>();
            for (String h : hooks.split(",")) {
                if (!h.isBlank()) names.add(h.trim());
            }
            if (!names.isEmpty()) stateHooks = names;
        }

        String lookbehind = props.getProperty(PREFIX + "destructuring-lookbehind");
        if (lookbehind != null) {
            try {
                destructuringLookbehind = Integer.parseInt(lookbehind.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid {}destructuring-lookbehind '{}', keeping {}", PREFIX, lookbehind, destructuringLookbehind);
            }
        }

        String raw = props.getProperty(PREFIX + "raw-text-detection");
        if (raw != null) rawTextDetection = Boolean.parseBoolean(raw.trim());

        String semantic = props.getProperty(PREFIX + "semantic-detection");
        if (semantic != null) semanticDetection = Boolean.parseBoolean(semantic.trim());

        String min = props.getProperty(PREFIX + "min-confidence");
        if (min != null) {
            try {
                double v = Double.parseDouble(min.trim());
                if (v < 0.0 || v > 1.0) {
                    log.warn("{}min-confidence {} out of [0,1], keeping {}", PREFIX, v, minConfidence);
                } else {
                    minConfidence = v;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid {}min-confidence '{}', keeping {}", PREFIX, min, minConfidence);
            }
        }
        return this;
    }
}

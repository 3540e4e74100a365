package io.routeguide.store;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import io.routeguide.proto.FeatureDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.invoke.MethodHandles;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a feature database in the protobuf JSON mapping of {@link FeatureDatabase}, e.g.
 * <pre>
 * {"feature": [{"location": {"latitude": 407838351, "longitude": -746143763}, "name": "Patriots Path"}]}
 * </pre>
 * Loading either returns a complete store or throws. A partially read file never produces a store.
 */
public class FeatureLoader {

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String DEFAULT_FEATURES_RESOURCE = "io/routeguide/store/route_guide_db.json";

    private FeatureLoader() {
    }

    public static URL getDefaultFeaturesFile() throws FeatureLoadException {
        final URL url = FeatureLoader.class.getClassLoader().getResource(DEFAULT_FEATURES_RESOURCE);
        if (url == null) {
            throw new FeatureLoadException("Default features resource not found: " + DEFAULT_FEATURES_RESOURCE);
        }
        return url;
    }

    public static FeatureStore loadDefault() throws FeatureLoadException {
        return load(getDefaultFeaturesFile());
    }

    public static FeatureStore load(Path path) throws FeatureLoadException {
        if (!Files.isRegularFile(path)) {
            throw new FeatureLoadException("Features file not found: " + path);
        }
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input, path.toString());
        } catch (IOException e) {
            throw new FeatureLoadException("Failed to read features file " + path, e);
        }
    }

    public static FeatureStore load(URL url) throws FeatureLoadException {
        try (InputStream input = url.openStream()) {
            return parse(input, url.toString());
        } catch (IOException e) {
            throw new FeatureLoadException("Failed to read features from " + url, e);
        }
    }

    /**
     * @param featuresFile a file path or an empty string for the bundled dataset
     */
    public static FeatureStore load(String featuresFile) throws FeatureLoadException {
        if (featuresFile == null || featuresFile.isBlank()) {
            return loadDefault();
        }
        return load(Path.of(featuresFile));
    }

    public static FeatureStore parse(InputStream input, String source) throws FeatureLoadException {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            FeatureDatabase.Builder database = FeatureDatabase.newBuilder();
            JsonFormat.parser().merge(reader, database);
            final FeatureStore store = new FeatureStore(database.getFeatureList());
            log.info("Loaded {} features from {}", store.size(), source);
            return store;
        } catch (InvalidProtocolBufferException e) {
            throw new FeatureLoadException("Malformed features in " + source + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FeatureLoadException("Failed to read features from " + source, e);
        }
    }
}

package com.libragraph.stash.formats.registry;

import com.libragraph.stash.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Central registry of compression codecs. All {@link Codec} beans are discovered via CDI.
 */
@ApplicationScoped
public class CodecRegistry {

    private static final Logger log = Logger.getLogger(CodecRegistry.class);

    /** Header size to read for frame detection. */
    public static final int HEADER_SIZE = 16;

    private final List<Codec> codecs;

    @Inject
    public CodecRegistry(Instance<Codec> codecs) {
        this.codecs = StreamSupport.stream(codecs.spliterator(), false).toList();
        log.debugf("Registered %d codec(s): %s", this.codecs.size(),
                this.codecs.stream().map(Codec::name).toList());
    }

    private CodecRegistry(List<Codec> codecs) {
        this.codecs = List.copyOf(codecs);
    }

    /**
     * Builds a registry from explicit codec instances (outside a CDI container).
     */
    public static CodecRegistry of(Codec... codecs) {
        return new CodecRegistry(List.of(codecs));
    }

    /**
     * Finds a codec by its name.
     */
    public Optional<Codec> byName(String name) {
        return codecs.stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    /**
     * Returns the named codec or fails; used where configuration names a codec.
     */
    public Codec require(String name) {
        return byName(name).orElseThrow(() ->
                new IllegalStateException("No codec registered under name: " + name));
    }

    /**
     * Finds a codec whose frame signature matches the given header.
     */
    public Optional<Codec> detect(byte[] header) {
        return codecs.stream()
                .filter(c -> c.matches(header))
                .findFirst();
    }
}

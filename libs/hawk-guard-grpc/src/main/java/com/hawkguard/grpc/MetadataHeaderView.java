package com.hawkguard.grpc;

import com.hawkguard.guard.HeaderView;
import io.grpc.Metadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link HeaderView} over gRPC call metadata. Metadata keys are lower case, so names are
 * lower-cased before lookup.
 */
public final class MetadataHeaderView implements HeaderView {

    private final Metadata metadata;

    public MetadataHeaderView(Metadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public List<String> values(String name) {
        var key = Metadata.Key.of(name.toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER);
        Iterable<String> values = metadata.getAll(key);
        if (values == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        values.forEach(result::add);
        return result;
    }
}

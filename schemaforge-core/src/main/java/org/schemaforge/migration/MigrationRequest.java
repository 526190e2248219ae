package org.schemaforge.migration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.schemaforge.classify.ConfirmationProvider;

import java.nio.file.Path;
import java.time.Clock;

@Value
@Builder
public class MigrationRequest {
    @NonNull Path entitiesDir;
    @NonNull Path migrationsDir;
    boolean force;
    @Builder.Default ConfirmationProvider confirmationProvider = ConfirmationProvider.decline();
    @Builder.Default Clock clock = Clock.systemUTC();
}

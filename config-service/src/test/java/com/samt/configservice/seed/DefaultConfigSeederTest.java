package com.samt.configservice.seed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.ConfigAlreadyExistsException;
import com.samt.configservice.exception.ConfigValidationException;
import com.samt.configservice.schema.SchemaCompiler;
import com.samt.configservice.schema.ValidationResult;
import com.samt.configservice.service.ConfigEngine;
import com.samt.configservice.service.CreateConfigCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class DefaultConfigSeederTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ConfigEngine engine;
    private DefaultConfigSeeder seeder;

    @BeforeEach
    void setUp() {
        engine = mock(ConfigEngine.class);
        seeder = new DefaultConfigSeeder(engine, objectMapper);
    }

    @Test
    void createsTheFivePlatformEntriesAsSystem() throws Exception {
        int created = seeder.seed();

        ArgumentCaptor<CreateConfigCommand> commands = ArgumentCaptor.forClass(CreateConfigCommand.class);
        verify(engine, times(5)).createConfig(commands.capture());
        assertThat(created).isEqualTo(5);

        Map<String, CreateConfigCommand> byKey = commands.getAllValues().stream()
            .collect(Collectors.toMap(CreateConfigCommand::key, Function.identity()));
        assertThat(byKey).containsOnlyKeys(
            "cpa_level_amounts", "cpa_validation_rules", "system_settings", "mlm_settings", "external_apis");
        assertThat(commands.getAllValues()).allMatch(command -> "system".equals(command.actor()));
        assertThat(byKey.get("cpa_level_amounts").kind()).isEqualTo(ConfigKind.CPA);
        assertThat(byKey.get("external_apis").kind()).isEqualTo(ConfigKind.INTEGRATION);
        assertThat(byKey.get("mlm_settings").category()).isEqualTo("hierarchy");
    }

    @Test
    void everySeedValuePassesItsOwnSchema() throws Exception {
        seeder.seed();

        ArgumentCaptor<CreateConfigCommand> commands = ArgumentCaptor.forClass(CreateConfigCommand.class);
        verify(engine, times(5)).createConfig(commands.capture());

        SchemaCompiler compiler = new SchemaCompiler();
        for (CreateConfigCommand command : commands.getAllValues()) {
            ValidationResult result = compiler.compile(command.validationSchema()).validate(command.value());
            assertThat(result.valid()).as(command.key() + " " + result.errors()).isTrue();
        }
    }

    @Test
    void existingEntriesAreSkipped() throws Exception {
        when(engine.createConfig(argThat(command -> command != null && List.of("system_settings", "mlm_settings").contains(command.key()))))
            .thenAnswer(invocation -> {
                throw new ConfigAlreadyExistsException(invocation.<CreateConfigCommand>getArgument(0).key());
            });

        int created = seeder.seed();

        assertThat(created).isEqualTo(3);
        verify(engine, times(5)).createConfig(any());
    }

    @Test
    void invalidSeedAbortsStartup() {
        when(engine.createConfig(any())).thenThrow(new ConfigValidationException("system_settings", List.of()));

        assertThatThrownBy(() -> seeder.run(null))
            .isInstanceOf(ConfigValidationException.class);
    }
}

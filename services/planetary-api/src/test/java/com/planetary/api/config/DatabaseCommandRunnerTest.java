package com.planetary.api.config;

import com.planetary.api.service.DatabaseAdminService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatabaseCommandRunner unit tests")
class DatabaseCommandRunnerTest {

    @Mock
    private DatabaseAdminService databaseAdminService;
    @InjectMocks
    private DatabaseCommandRunner runner;

    @Test
    @DisplayName("commands run in the order they were given")
    void run_InOrder() {
        // when
        runner.run(new DefaultApplicationArguments("db_drop", "db_create", "db_seed"));

        // then
        InOrder order = inOrder(databaseAdminService);
        order.verify(databaseAdminService).dropAll();
        order.verify(databaseAdminService).createAll();
        order.verify(databaseAdminService).seed();
    }

    @Test
    @DisplayName("options and unknown arguments are ignored")
    void run_IgnoresOtherArguments() {
        // when
        runner.run(new DefaultApplicationArguments("--server.port=8080", "db_create", "serve"));

        // then
        verify(databaseAdminService).createAll();
        verify(databaseAdminService, never()).dropAll();
        verify(databaseAdminService, never()).seed();
    }

    @Test
    @DisplayName("no arguments means no admin work")
    void run_NoArguments() {
        // when
        runner.run(new DefaultApplicationArguments());

        // then
        verifyNoInteractions(databaseAdminService);
    }

    @Test
    @DisplayName("admin command detection on raw program arguments")
    void anyPresent() {
        assertThat(DatabaseCommand.anyPresent("db_seed")).isTrue();
        assertThat(DatabaseCommand.anyPresent("--debug", "db_drop")).isTrue();
        assertThat(DatabaseCommand.anyPresent("--debug")).isFalse();
        assertThat(DatabaseCommand.anyPresent()).isFalse();
    }
}

package com.directory.actions.directory;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PowerShellDirectoryGatewayTest {

    @Mock
    private ScriptRunner runner;

    private PowerShellDirectoryGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new PowerShellDirectoryGateway(runner, "OU=Staff,DC=corp,DC=local");
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("Parses a JSON array of users")
        void testParsesArray() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("""
                    [{"sAMAccountName":"nivanova","displayName":"Ivanova N.","distinguishedName":"CN=Ivanova N.,OU=Staff","Enabled":true},
                     {"sAMAccountName":"mivanova","displayName":"Ivanova M.","distinguishedName":"CN=Ivanova M.,OU=Staff","Enabled":false}]
                    """);

            List<Identity> result = gateway.search("Ivanova");

            assertEquals(2, result.size());
            assertEquals("nivanova", result.get(0).handle());
            assertEquals("Ivanova N.", result.get(0).displayName());
            assertFalse(result.get(1).enabled());
        }

        @Test
        @DisplayName("A single match serialised as an object is accepted")
        void testParsesSingleObject() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("{\"sAMAccountName\":\"alice\",\"displayName\":\"Alice\"}");

            List<Identity> result = gateway.search("alice");

            assertEquals(1, result.size());
            assertEquals("alice", result.get(0).handle());
        }

        @Test
        @DisplayName("Empty output means no match")
        void testEmptyOutput() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("  ");

            assertTrue(gateway.search("nobody").isEmpty());
        }

        @Test
        @DisplayName("Unreadable output is a DirectoryException")
        void testUnreadableOutput() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("Get-ADUser : The server has rejected the client credentials.");

            assertThrows(DirectoryException.class, () -> gateway.search("alice"));
        }

        @Test
        @DisplayName("Quotes in the query are escaped in the script")
        void testQueryIsEscaped() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("[]");

            gateway.search("O'Brien");

            ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
            verify(runner).run(script.capture());
            assertTrue(script.getValue().contains("*O''Brien*"));
            assertFalse(script.getValue().contains("*O'Brien*"));
            assertTrue(script.getValue().contains("-SearchBase 'OU=Staff,DC=corp,DC=local'"));
        }

        @Test
        @DisplayName("Typographic quotes and wildcards in the query stay inside the literal")
        void testQueryTypographicQuotesAndWildcards() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("[]");

            gateway.search("x\u2019; Remove-ADUser bob -Confirm:$false; \u2018 [");

            ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
            verify(runner).run(script.capture());
            assertTrue(script.getValue().contains(
                    "-like '*x\u2019\u2019; Remove-ADUser bob -Confirm:$false; \u2018\u2018 `[*'"));
        }

        @Test
        @DisplayName("Without a search base the parameter is omitted")
        void testNoSearchBase() throws DirectoryException {
            PowerShellDirectoryGateway noBase = new PowerShellDirectoryGateway(runner, "");
            when(runner.run(anyString())).thenReturn("[]");

            noBase.search("alice");

            ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
            verify(runner).run(script.capture());
            assertFalse(script.getValue().contains("-SearchBase"));
        }
    }

    @Nested
    @DisplayName("Actions")
    class Actions {

        @Test
        @DisplayName("Disable succeeds when the script prints OK")
        void testDisableOk() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("OK\r\n");

            ActionOutcome outcome = gateway.performAction(JobType.DISABLE_ACCOUNT, "alice");

            assertTrue(outcome.success());
            ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
            verify(runner).run(script.capture());
            assertTrue(script.getValue().contains("Disable-ADAccount -Identity 'alice'"));
        }

        @Test
        @DisplayName("Any other output is a failed outcome")
        void testDisableUnexpectedOutput() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("WARNING: something odd");

            ActionOutcome outcome = gateway.performAction(JobType.DISABLE_ACCOUNT, "alice");

            assertFalse(outcome.success());
            assertTrue(outcome.message().contains("something odd"));
        }

        @Test
        @DisplayName("Password reset forces a change at next logon")
        void testResetPassword() throws DirectoryException {
            when(runner.run(anyString())).thenReturn("OK");

            assertTrue(gateway.resetPassword("alice", "Abc123!@#xyz").success());

            ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
            verify(runner).run(script.capture());
            assertTrue(script.getValue().contains("-ChangePasswordAtLogon $true"));
            assertTrue(script.getValue().contains("'Abc123!@#xyz'"));
        }

        @Test
        @DisplayName("Invalid handles are rejected before any script runs")
        void testInvalidHandle() throws DirectoryException {
            assertThrows(IllegalArgumentException.class,
                    () -> gateway.performAction(JobType.DISABLE_ACCOUNT, "alice'; Remove-ADUser bob"));
            assertThrows(IllegalArgumentException.class,
                    () -> gateway.resetPassword("bad handle", "Abc123!@#xyz"));
            verify(runner, never()).run(anyString());
        }

        @Test
        @DisplayName("Runner failures propagate as DirectoryException")
        void testRunnerFailure() throws DirectoryException {
            when(runner.run(anyString())).thenThrow(new DirectoryException("PowerShell exited with code 1"));

            assertThrows(DirectoryException.class, () -> gateway.performAction(JobType.DISABLE_ACCOUNT, "alice"));
        }
    }

    @Test
    @DisplayName("Dry-run gateway finds nothing and succeeds")
    void testNoOpGateway() {
        NoOpDirectoryGateway noop = new NoOpDirectoryGateway();
        assertTrue(noop.search("anyone").isEmpty());
        assertTrue(noop.performAction(JobType.DISABLE_ACCOUNT, "alice").success());
        assertTrue(noop.resetPassword("alice", "x").success());
    }
}

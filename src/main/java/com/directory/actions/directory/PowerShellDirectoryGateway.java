package com.directory.actions.directory;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.JobType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Active Directory gateway driving the ActiveDirectory PowerShell module.
 * Searches return JSON produced by {@code ConvertTo-Json}; actions print {@code OK} on success.
 */
public class PowerShellDirectoryGateway implements DirectorySearch, DirectoryActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(PowerShellDirectoryGateway.class);

    /** Upper bound on raw rows taken from one search. */
    static final int MAX_RAW_RESULTS = 100;

    private final ScriptRunner runner;
    private final String searchBase;
    private final ObjectMapper objectMapper;

    public PowerShellDirectoryGateway(ScriptRunner runner, String searchBase) {
        this.runner = runner;
        this.searchBase = searchBase;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<Identity> search(String queryText) throws DirectoryException {
        InputSanitizer.validateQuery(queryText);
        String q = InputSanitizer.escapeLikePattern(queryText.strip());
        String base = searchBase == null || searchBase.isBlank()
                ? ""
                : "-SearchBase '" + InputSanitizer.escapePowerShell(searchBase) + "' ";
        String script = """
                Import-Module ActiveDirectory;
                Get-ADUser -LDAPFilter '(objectClass=user)' %s-Properties displayName,distinguishedName,enabled,sAMAccountName |
                  Where-Object { $_.displayName -like '*%s*' -or $_.sAMAccountName -like '*%s*' -or $_.Name -like '*%s*' } |
                  Select-Object -First %d sAMAccountName, displayName, distinguishedName, Enabled |
                  ConvertTo-Json -Compress
                """.formatted(base, q, q, q, MAX_RAW_RESULTS);
        return parseIdentities(runner.run(script));
    }

    @Override
    public ActionOutcome performAction(JobType jobType, String targetHandle) throws DirectoryException {
        InputSanitizer.validateHandle(targetHandle);
        if (jobType != JobType.DISABLE_ACCOUNT) {
            return ActionOutcome.failed("Unsupported job type: " + jobType);
        }
        String script = """
                Import-Module ActiveDirectory;
                Disable-ADAccount -Identity '%s';
                Write-Output "OK"
                """.formatted(InputSanitizer.escapePowerShell(targetHandle));
        return toOutcome(runner.run(script));
    }

    @Override
    public ActionOutcome resetPassword(String targetHandle, String newPassword) throws DirectoryException {
        InputSanitizer.validateHandle(targetHandle);
        String script = """
                Import-Module ActiveDirectory;
                $sam = '%s';
                $pwd = ConvertTo-SecureString '%s' -AsPlainText -Force;
                Set-ADAccountPassword -Identity $sam -Reset -NewPassword $pwd;
                Set-ADUser -Identity $sam -ChangePasswordAtLogon $true;
                Write-Output "OK"
                """.formatted(InputSanitizer.escapePowerShell(targetHandle),
                InputSanitizer.escapePowerShell(newPassword));
        return toOutcome(runner.run(script));
    }

    List<Identity> parseIdentities(String raw) throws DirectoryException {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DirectoryException("Unreadable search output", e);
        }

        List<Identity> identities = new ArrayList<>();
        // A single match is serialised as an object rather than an array
        Iterable<JsonNode> rows = root.isArray() ? root : List.of(root);
        for (JsonNode row : rows) {
            if (identities.size() >= MAX_RAW_RESULTS) {
                break;
            }
            String handle = row.path("sAMAccountName").asText("");
            if (handle.isBlank()) {
                log.debug("Skipping directory row without sAMAccountName: {}", row);
                continue;
            }
            identities.add(new Identity(
                    handle,
                    row.path("displayName").asText(""),
                    row.path("distinguishedName").asText(""),
                    row.path("Enabled").asBoolean(true)));
        }
        return identities;
    }

    private static ActionOutcome toOutcome(String output) {
        String trimmed = output == null ? "" : output.strip();
        return trimmed.endsWith("OK")
                ? ActionOutcome.ok(trimmed)
                : ActionOutcome.failed("Unexpected PowerShell output: " + trimmed);
    }
}

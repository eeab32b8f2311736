package com.directory.actions.resolver;

import com.directory.actions.core.model.Identity;
import com.directory.actions.directory.DirectoryException;
import com.directory.actions.directory.DirectorySearch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock
    private DirectorySearch directorySearch;

    private static Identity identity(String handle, String displayName) {
        return new Identity(handle, displayName, "", true);
    }

    @Test
    @DisplayName("Ivanova: two prefix matches, ranked by similarity")
    void testIvanovaScenario() throws DirectoryException {
        when(directorySearch.search("Ivanova")).thenReturn(List.of(
                identity("nivanova", "Ivanova N."),
                identity("mivanova", "Ivanova M.")));
        IdentityResolver resolver = new IdentityResolver(directorySearch);

        CandidateSet result = resolver.resolve("Ivanova");

        assertEquals(2, result.size());
        assertFalse(result.isUnambiguous());
        List<ScoredIdentity> candidates = result.candidates();
        assertTrue(candidates.get(0).score() >= candidates.get(1).score());
        assertTrue(candidates.stream().allMatch(c -> c.score() >= 0.9));
    }

    @Test
    @DisplayName("Label prefix matches are listed before mid-label matches")
    void testPrefixMatchesFirst() throws DirectoryException {
        when(directorySearch.search("Ivanova")).thenReturn(List.of(
                identity("aivanova", "Anna Ivanova"),
                identity("pivanovskiy", "Petr Ivanovskiy"),
                identity("ivanova_m", "Ivanova Maria")));
        IdentityResolver resolver = new IdentityResolver(directorySearch);

        CandidateSet result = resolver.resolve("Ivanova");

        assertEquals(3, result.size());
        assertEquals("ivanova_m", result.candidates().get(0).handle());
    }

    @Test
    @DisplayName("Equal scores keep the directory order")
    void testStableOrder() throws DirectoryException {
        when(directorySearch.search("ivanov")).thenReturn(List.of(
                identity("ivanov1", ""),
                identity("ivanov2", "")));
        CandidateSet result = new IdentityResolver(directorySearch).resolve("ivanov");

        assertEquals(List.of("ivanov1", "ivanov2"),
                result.candidates().stream().map(ScoredIdentity::handle).toList());
    }

    @Test
    @DisplayName("A single match is unambiguous")
    void testSingleMatch() throws DirectoryException {
        when(directorySearch.search("alice")).thenReturn(List.of(identity("alice", "Alice Smith")));

        CandidateSet result = new IdentityResolver(directorySearch).resolve("alice");

        assertTrue(result.isUnambiguous());
        assertEquals("alice", result.single().orElseThrow().handle());
    }

    @Test
    @DisplayName("Results are capped at the limit")
    void testLimit() throws DirectoryException {
        List<Identity> many = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            many.add(identity("petrov" + i, "Petrov " + i));
        }
        when(directorySearch.search("Petrov")).thenReturn(many);
        IdentityResolver resolver = new IdentityResolver(directorySearch);

        assertEquals(IdentityResolver.DEFAULT_LIMIT, resolver.resolve("Petrov").size());
        assertEquals(3, resolver.resolve("Petrov", 3).size());
    }

    @Test
    @DisplayName("Blank or oversized queries never reach the directory")
    void testInvalidQueries() throws DirectoryException {
        IdentityResolver resolver = new IdentityResolver(directorySearch);

        assertTrue(resolver.resolve("   ").isEmpty());
        assertTrue(resolver.resolve(null).isEmpty());
        assertTrue(resolver.resolve("x".repeat(500)).isEmpty());
        verify(directorySearch, never()).search(anyString());
    }

    @Test
    @DisplayName("Search failures yield an empty set")
    void testSearchFailure() throws DirectoryException {
        when(directorySearch.search("bob")).thenThrow(new DirectoryException("PowerShell exited with code 1"));

        assertTrue(new IdentityResolver(directorySearch).resolve("bob").isEmpty());
    }

    @Test
    @DisplayName("Empty search result yields an empty set")
    void testNoMatch() throws DirectoryException {
        when(directorySearch.search("nobody")).thenReturn(List.of());

        assertTrue(new IdentityResolver(directorySearch).resolve("nobody").isEmpty());
    }

    @Test
    @DisplayName("findByHandle ignores case")
    void testFindByHandle() {
        CandidateSet set = new CandidateSet("q", List.of(
                new ScoredIdentity(identity("JDoe", "John Doe"), 0.9)));
        assertTrue(set.findByHandle("jdoe").isPresent());
        assertTrue(set.findByHandle("other").isEmpty());
        assertTrue(set.findByHandle(null).isEmpty());
    }
}

package com.opsdashboard.infrastructure.persistence.store;

import com.opsdashboard.domain.exception.QueryExecutionException;
import com.opsdashboard.infrastructure.persistence.entity.TransactionEntity;
import com.opsdashboard.infrastructure.persistence.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Checks how data access failures surface from a store.
 */
@ExtendWith(MockitoExtension.class)
class TransactionRecordStoreTest {

    @Mock
    private TransactionRepository repository;

    private TransactionRecordStore store;

    @BeforeEach
    void setUp() {
        store = new TransactionRecordStore(repository);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindMatching_ConnectionFailureIsUnavailable() {
        when(repository.findAll(any(Specification.class), any(Sort.class)))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        QueryExecutionException ex = assertThrows(QueryExecutionException.class, () -> store.findMatching(List.of()));

        assertEquals(QueryExecutionException.Kind.STORE_UNAVAILABLE, ex.getKind());
        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
    }

    @Test
    void testFindDistinctValues_TransactionFailureIsUnavailable() {
        when(repository.findDistinctCategories()).thenThrow(new CannotCreateTransactionException("pool exhausted"));

        QueryExecutionException ex = assertThrows(QueryExecutionException.class, () ->
                store.findDistinctValues("category"));

        assertEquals(QueryExecutionException.Kind.STORE_UNAVAILABLE, ex.getKind());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindMatching_BadQueryIsQueryFailed() {
        when(repository.findAll(any(Specification.class), any(Sort.class)))
                .thenThrow(new InvalidDataAccessResourceUsageException("relation \"transactions\" does not exist"));

        QueryExecutionException ex = assertThrows(QueryExecutionException.class, () -> store.findMatching(List.of()));

        assertEquals(QueryExecutionException.Kind.QUERY_FAILED, ex.getKind());
    }

    @Test
    void testFindMatching_MapsEntitiesInStoreOrder() {
        doReturn(List.of(
                TransactionEntity.builder().id(7L).category("sales").amount(1.0).build(),
                TransactionEntity.builder().id(9L).category("refund").amount(2.0).build()))
                .when(repository).findAll(any(Specification.class), any(Sort.class));

        assertEquals(List.of(7L, 9L), store.findMatching(List.of()).stream().map(r -> r.getId()).toList());
        verify(repository).findAll(any(Specification.class), eq(Sort.by(Sort.Direction.ASC, "id")));
    }
}

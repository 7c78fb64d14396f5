package kr.jemi.zcloset.integration;

import kr.jemi.zcloset.common.store.DocumentStore;
import kr.jemi.zcloset.common.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestBase {

    @Autowired
    protected DocumentStore documentStore;

    @BeforeEach
    void cleanUp() {
        ((InMemoryDocumentStore) documentStore).clear();
    }
}

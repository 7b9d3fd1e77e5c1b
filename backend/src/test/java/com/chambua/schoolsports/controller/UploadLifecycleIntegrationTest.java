package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.StoredFile;
import com.chambua.schoolsports.service.UploadKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UploadLifecycleIntegrationTest extends ApiIntegrationTestSupport {

    @Autowired private PlatformTransactionManager transactionManager;

    private static MockMultipartFile png() {
        return new MockMultipartFile("image", "shot.png", "image/png", new byte[]{7, 7});
    }

    @Test
    void rolledBackTransactionDiscardsStoredFile() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        StoredFile stored = tx.execute(status -> {
            StoredFile f = storage.store(png(), UploadKind.EVENT_IMAGE);
            assertThat(Files.exists(storage.getUploadDir().resolve(f.storedName()))).isTrue();
            status.setRollbackOnly();
            return f;
        });
        assertThat(uploadExists(stored.url())).isFalse();
    }

    @Test
    void committedTransactionKeepsFileAndDefersDeletes() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        StoredFile kept = tx.execute(status -> storage.store(png(), UploadKind.EVENT_IMAGE));
        assertThat(uploadExists(kept.url())).isTrue();

        tx.executeWithoutResult(status -> {
            storage.deleteAfterCommit(kept.url());
            assertThat(uploadExists(kept.url())).isTrue();
            status.setRollbackOnly();
        });
        assertThat(uploadExists(kept.url())).isTrue();

        tx.executeWithoutResult(status -> storage.deleteAfterCommit(kept.url()));
        assertThat(uploadExists(kept.url())).isFalse();
    }

    @Test
    void storedFilesAreServed() throws Exception {
        StoredFile f = storage.store(png(), UploadKind.EVENT_IMAGE);
        mvc.perform(get("/uploads/" + f.storedName()))
                .andExpect(status().isOk())
                .andExpect(content().bytes(new byte[]{7, 7}));
        mvc.perform(get("/uploads/missing-file.png"))
                .andExpect(status().isNotFound());
        storage.delete(f.storedName());
    }
}

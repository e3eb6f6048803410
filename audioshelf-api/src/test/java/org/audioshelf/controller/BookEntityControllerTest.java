package org.audioshelf.controller;

import org.audioshelf.exception.ApiError;
import org.audioshelf.exception.GlobalExceptionHandler;
import org.audioshelf.exception.PersistenceException;
import org.audioshelf.mapper.BookEntityMapper;
import org.audioshelf.model.dto.BatchResult;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.service.BookOrganizerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BookEntityControllerTest {

    @Mock
    private BookOrganizerService bookOrganizerService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        BookEntityMapper mapper = Mappers.getMapper(BookEntityMapper.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new BookEntityController(bookOrganizerService, mapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void scan_shouldReturnEntities() throws Exception {
        when(bookOrganizerService.scan("/library")).thenReturn(List.of(entity("dune")));

        mockMvc.perform(post("/api/v1/entities/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootPath\": \"/library\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("dune"))
                .andExpect(jsonPath("$[0].relative_path").value("Frank Herbert/Dune"))
                .andExpect(jsonPath("$[0].pattern").value("AuthorFolder>Book"))
                .andExpect(jsonPath("$[0].status").value("pending"))
                .andExpect(jsonPath("$[0].title.source").value("unresolved"))
                .andExpect(jsonPath("$[0].complete").value(false));
        verify(bookOrganizerService, never()).resolveAll(any(List.class));
    }

    @Test
    void scan_shouldUseConfiguredRootWithoutBody() throws Exception {
        when(bookOrganizerService.scan(null)).thenThrow(ApiError.LIBRARY_ROOT_NOT_CONFIGURED.createException());

        mockMvc.perform(post("/api/v1/entities/scan"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void getEntity_shouldReturnNotFoundForUnknownId() throws Exception {
        when(bookOrganizerService.getEntity("nope")).thenThrow(ApiError.ENTITY_NOT_FOUND.createException("nope"));

        mockMvc.perform(get("/api/v1/entities/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Book entity not found with id: nope"));
    }

    @Test
    void setStatus_shouldApplyStatus() throws Exception {
        when(bookOrganizerService.setStatus("dune", ApprovalStatus.APPROVED))
                .thenReturn(entity("dune").withStatus(ApprovalStatus.APPROVED));

        mockMvc.perform(put("/api/v1/entities/dune/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"approved\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"));
    }

    @Test
    void setStatus_shouldRejectMissingStatus() throws Exception {
        mockMvc.perform(put("/api/v1/entities/dune/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(bookOrganizerService, never()).setStatus(anyString(), any());
    }

    @Test
    void resolveAll_shouldReturnBatchCounts() throws Exception {
        when(bookOrganizerService.resolveAll()).thenReturn(BatchResult.builder().total(3).resolved(2).incomplete(1).build());

        mockMvc.perform(post("/api/v1/entities/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.resolved").value(2))
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void cancelBatch_shouldReportWhetherBatchWasRunning() throws Exception {
        when(bookOrganizerService.cancelBatch()).thenReturn(true);

        mockMvc.perform(post("/api/v1/entities/resolve/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void save_shouldReportWrittenCount() throws Exception {
        when(bookOrganizerService.save()).thenReturn(4);

        mockMvc.perform(post("/api/v1/entities/save"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.saved").value(4));
    }

    @Test
    void save_shouldReturnServerErrorWhenDocumentCannotBeWritten() throws Exception {
        when(bookOrganizerService.save()).thenThrow(
                new PersistenceException("Failed to write /store/entries.json: disk full", new IOException("disk full")));

        mockMvc.perform(post("/api/v1/entities/save"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.message").value("Failed to write /store/entries.json: disk full"));
    }

    private static BookEntity entity(String id) {
        Path dir = Path.of("/library/Frank Herbert/Dune");
        return BookEntity.pending(BookCandidate.builder()
                .id(id)
                .rootPath(dir)
                .directory(dir)
                .relativePath("Frank Herbert/Dune")
                .relativeDirectory("Frank Herbert/Dune")
                .file(dir.resolve("01.mp3"))
                .pattern(FolderPattern.AUTHOR_FOLDER_BOOK)
                .build());
    }
}

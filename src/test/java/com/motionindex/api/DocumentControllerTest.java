package com.motionindex.api;

import com.motionindex.processing.pipeline.DocumentPipeline;
import com.motionindex.processing.pipeline.PipelineRequest;
import com.motionindex.processing.pipeline.PipelineResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice test for single-document processing: request mapping onto pipeline options.
 */
@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentPipeline documentPipeline;

    @Test
    void testMapsFormFieldsOntoPipelineRequest() throws Exception {
        when(documentPipeline.process(any(PipelineRequest.class))).thenReturn(new PipelineResult("doc-1"));
        MockMultipartFile file = new MockMultipartFile("file", "motion.pdf", "application/pdf", "%PDF-1.7".getBytes());

        mockMvc.perform(multipart("/api/documents/process")
                        .file(file)
                        .param("documentId", "doc-1")
                        .param("store", "false")
                        .param("deferIndexing", "true")
                        .param("timeoutSeconds", "30")
                        .param("caseName", "Doe v. Acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("doc-1"))
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(documentPipeline).process(captor.capture());
        PipelineRequest request = captor.getValue();
        assertThat(request.getDocumentId()).isEqualTo("doc-1");
        assertThat(request.getFileName()).isEqualTo("motion.pdf");
        assertThat(request.getContentType()).isEqualTo("application/pdf");
        assertThat(request.getOptions().isExtractText()).isTrue();
        assertThat(request.getOptions().isStoreDocument()).isFalse();
        assertThat(request.getOptions().isDeferIndexing()).isTrue();
        assertThat(request.getOptions().getTimeoutSeconds()).isEqualTo(30);
        assertThat(request.getMetadata()).containsEntry("case_name", "Doe v. Acme").doesNotContainKey("author");
    }

    @Test
    void testEmptyFileIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

        mockMvc.perform(multipart("/api/documents/process").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("IllegalArgument"))
                .andExpect(jsonPath("$.message").value("File is empty"));

        verifyNoInteractions(documentPipeline);
    }

    @Test
    void testNonPositiveTimeoutIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "order.txt", "text/plain", "ORDER".getBytes());

        mockMvc.perform(multipart("/api/documents/process").file(file).param("timeoutSeconds", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("timeoutSeconds must be positive"));
    }
}

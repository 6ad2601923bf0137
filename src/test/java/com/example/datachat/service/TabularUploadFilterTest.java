package com.example.datachat.service;

import com.example.datachat.model.entity.FileAttachment;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TabularUploadFilterTest {

    private final TabularUploadFilter filter = new TabularUploadFilter();

    @Test
    void keepsOnlyDelimitedTextFiles() {
        List<MultipartFile> uploads = List.of(
                file("ventas.csv", "text/csv", "a,b\n1,2\n"),
                file("foto.png", "image/png", "PNG"),
                file("datos.TSV", "application/octet-stream", "a\tb\n"),
                file("export", "text/csv; charset=utf-8", "x\n1\n")
        );

        List<FileAttachment> kept = filter.retain(uploads);

        assertThat(kept).extracting(FileAttachment::getOriginalName)
                .containsExactly("ventas.csv", "datos.TSV", "export");
        assertThat(kept.get(0).getRawContent()).isEqualTo("a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));
        assertThat(kept.get(0).getSizeBytes()).isEqualTo(8);
    }

    @Test
    void emptyFilesAndNullListAreIgnored() {
        assertThat(filter.retain(null)).isEmpty();
        assertThat(filter.retain(List.of(file("vacio.csv", "text/csv", "")))).isEmpty();
    }

    @Test
    void missingNameGetsDefault() {
        List<FileAttachment> kept = filter.retain(List.of(file("", "text/csv", "a\n1\n")));

        assertThat(kept).extracting(FileAttachment::getOriginalName).containsExactly("dataset.csv");
    }

    @Test
    void overlongNamesAndMediaTypesAreCutToFitKeepingExtension() {
        String longName = "n".repeat(300) + ".csv";
        String longType = "text/csv; " + "p=v; ".repeat(40);

        List<FileAttachment> kept = filter.retain(List.of(file(longName, longType, "a\n1\n")));

        FileAttachment f = kept.get(0);
        assertThat(f.getOriginalName()).hasSize(FileAttachment.NAME_MAX_LENGTH).endsWith(".csv");
        assertThat(f.getMediaType()).isEqualTo("text/csv");
        assertThat(TabularUploadFilter.fitName("corto.csv")).isEqualTo("corto.csv");
    }

    @Test
    void detectionByExtensionOrMediaType() {
        assertThat(TabularUploadFilter.isTabular("a.csv", null)).isTrue();
        assertThat(TabularUploadFilter.isTabular("a.txt", "text/tab-separated-values")).isTrue();
        assertThat(TabularUploadFilter.isTabular("a.xlsx", "application/vnd.ms-excel")).isFalse();
        assertThat(TabularUploadFilter.isTabular(null, null)).isFalse();
    }

    private static MockMultipartFile file(String name, String type, String content) {
        return new MockMultipartFile("files", name, type, content.getBytes(StandardCharsets.UTF_8));
    }
}

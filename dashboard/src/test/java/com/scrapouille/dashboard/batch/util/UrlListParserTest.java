package com.scrapouille.dashboard.batch.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlListParserTest {

    @Test
    void csvKeepsFirstColumnStripsQuotesAndDropsNonHttpRows() {
        String csv = "\"https://x.com\",ignored\nnot-a-url,x\n'https://y.com',x";

        List<String> urls = UrlListParser.parse(csv, UrlSource.CSV);

        assertThat(urls).containsExactly("https://x.com", "https://y.com");
    }

    @Test
    void csvHandlesWindowsLineEndingsAndHeaderRow() {
        String csv = "url,label\r\nhttps://a.example/page,first\r\n  https://b.example  ,second\r\n";

        assertThat(UrlListParser.parse(csv, UrlSource.CSV))
            .containsExactly("https://a.example/page", "https://b.example");
    }

    @Test
    void pastedTextKeepsEveryNonBlankLineInOrder() {
        String pasted = "  https://a.example  \n\n   \nftp://not-filtered.example\nhttps://b.example\n";

        assertThat(UrlListParser.parse(pasted, UrlSource.PASTED))
            .containsExactly("https://a.example", "ftp://not-filtered.example", "https://b.example");
    }

    @Test
    void textFileDropsLinesThatAreNotHttpUrls() {
        String file = "# exported list\nhttps://a.example\nwww.b.example\n\thttp://c.example\n";

        assertThat(UrlListParser.parse(file, UrlSource.TEXT_FILE))
            .containsExactly("https://a.example", "http://c.example");
    }

    @Test
    void duplicatesAreKeptAsSeparateEntries() {
        String pasted = "https://a.example\nhttps://a.example\nhttps://b.example";

        assertThat(UrlListParser.parse(pasted, UrlSource.PASTED))
            .containsExactly("https://a.example", "https://a.example", "https://b.example");
    }

    @Test
    void emptyOrNullInputYieldsEmptyList() {
        assertThat(UrlListParser.parse(null, UrlSource.PASTED)).isEmpty();
        assertThat(UrlListParser.parse("", UrlSource.CSV)).isEmpty();
        assertThat(UrlListParser.parse("\n\n", UrlSource.TEXT_FILE)).isEmpty();
    }

    @Test
    void stripQuotesRemovesAtMostOneQuoteOnEachSide() {
        assertThat(UrlListParser.stripQuotes("\"\"https://a.example\"")).isEqualTo("\"https://a.example");
        assertThat(UrlListParser.stripQuotes("'https://a.example")).isEqualTo("https://a.example");
        assertThat(UrlListParser.stripQuotes("\"")).isEmpty();
    }

    @Test
    void sourceIsResolvedFromFileNameAndRequestParam() {
        assertThat(UrlSource.fromFileName("urls.CSV")).isEqualTo(UrlSource.CSV);
        assertThat(UrlSource.fromFileName("urls.txt")).isEqualTo(UrlSource.TEXT_FILE);
        assertThat(UrlSource.fromParam(null)).isEqualTo(UrlSource.PASTED);
        assertThat(UrlSource.fromParam("txt")).isEqualTo(UrlSource.TEXT_FILE);
        assertThatThrownBy(() -> UrlSource.fromParam("xml"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

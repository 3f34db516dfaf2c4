package dk.lawoffice.intranet.frontend.console;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextRendererTest {

    private final TextRenderer renderer = new TextRenderer();
    private final String nl = System.lineSeparator();

    @Test
    void columnsAreSizedToTheWidestCell() {
        String table = renderer.table(new String[]{"ID", "NAME"}, List.of(
                new String[]{"1", "Robert Brown"},
                new String[]{"22", null}));

        assertEquals("ID  NAME" + nl
                + "--  ------------" + nl
                + "1   Robert Brown" + nl
                + "22" + nl, table);
    }

    @Test
    void emptyTable() {
        assertEquals(TextRenderer.EMPTY + nl, renderer.table(new String[]{"ID"}, List.of()));
    }

    @Test
    void shortIds() {
        assertEquals("0f3c9a77", TextRenderer.shortId("0f3c9a77-1111-2222-3333-444455556666"));
        assertEquals("abc", TextRenderer.shortId("abc"));
    }
}

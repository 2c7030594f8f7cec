package com.example.bookfetch.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bookfetch.domain.model.TemplateValidationResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathTemplateEngineTest {

    private final PathTemplateEngine engine = new PathTemplateEngine();

    @Test
    void substituteShouldRenderPlainPlaceholders() {
        Map<String, String> vars = vars("Andy Weir", "Project Hail Mary");
        vars.put("asin", "B08G9PRS1K");

        assertEquals("Andy Weir/Project Hail Mary B08G9PRS1K",
                engine.substitute(PathTemplateEngine.DEFAULT_TEMPLATE, vars));
    }

    @Test
    void substituteShouldRenderConditionalBlockWhenAllVariablesPresent() {
        Map<String, String> vars = vars("Brandon Sanderson", "The Final Empire");
        vars.put("series", "Mistborn");
        vars.put("seriesPart", "1");

        assertEquals("Brandon Sanderson/Mistborn/Book 1 - The Final Empire",
                engine.substitute("{author}/{series}/{Book seriesPart - }{title}", vars));
    }

    @Test
    void substituteShouldDropConditionalBlockWhenAnyVariableMissing() {
        Map<String, String> vars = vars("Andy Weir", "Project Hail Mary");
        vars.put("series", "Standalone");

        String withBlock = engine.substitute("{author}/{title}{ (series, Book seriesPart)}", vars);
        String withoutBlock = engine.substitute("{author}/{title}", vars);

        assertEquals(withoutBlock, withBlock);
        assertEquals("Andy Weir/Project Hail Mary", withBlock);
    }

    @Test
    void substituteShouldBeDeterministic() {
        Map<String, String> vars = vars("Douglas Adams", "The Hitchhiker's Guide");
        String template = "{author}/{series}/{title}";

        assertEquals(engine.substitute(template, vars), engine.substitute(template, vars));
    }

    @Test
    void substituteShouldStripIllegalCharactersFromValuesOnly() {
        Map<String, String> vars = vars("AC/DC", "What? Is: \"This\" <Book>*|");

        String rendered = engine.substitute("{author}/{title}", vars);

        assertEquals("ACDC/What Is This Book", rendered);
    }

    @Test
    void substituteShouldCollapseSeparatorsAndTrimEdges() {
        Map<String, String> vars = vars("Author", "Title");

        assertEquals("Author/Title", engine.substitute("//{author}//{series}///{title}/", vars));
    }

    @Test
    void substituteShouldCollapseWhitespaceAndTrimDotsInComponents() {
        Map<String, String> vars = vars("  Jane    Doe  ", "...Hidden Title...");

        assertEquals("Jane Doe/Hidden Title", engine.substitute("{author}/{title}", vars));
    }

    @Test
    void substituteShouldCapComponentLength() {
        StringBuilder longTitle = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            longTitle.append('a');
        }
        String rendered = engine.substitute("{author}/{title}", vars("Author", longTitle.toString()));

        assertEquals(200, rendered.split("/")[1].length());
    }

    @Test
    void substituteShouldEmitEscapedBracesLiterally() {
        assertEquals("Author/{Title}", engine.substitute("{author}/\\{{title}\\}", vars("Author", "Title")));
    }

    @Test
    void validateTemplateShouldRejectEmptyAndAbsoluteTemplates() {
        assertFalse(engine.validateTemplate("   ").isValid());
        assertFalse(engine.validateTemplate("/library/{author}").isValid());
        assertFalse(engine.validateTemplate("C:\\books\\{author}").isValid());
    }

    @Test
    void validateTemplateShouldRejectBlockWithoutKnownVariable() {
        TemplateValidationResult result = engine.validateTemplate("{author}/{Volume part}");

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("No valid variable found"));
    }

    @Test
    void validateTemplateShouldRejectInvalidCharactersOutsidePlaceholders() {
        TemplateValidationResult result = engine.validateTemplate("{author}/Best?/{title}");

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("?"));
    }

    @Test
    void validateTemplateShouldAcceptConditionalBlocksAndEscapes() {
        assertTrue(engine.validateTemplate("{author}/{series}/{Book seriesPart - }{title}").isValid());
        assertTrue(engine.validateTemplate("{author}/\\{{title}\\}").isValid());
    }

    @Test
    void validateFilenameTemplateShouldRejectSeparators() {
        assertFalse(engine.validateFilenameTemplate("{author}/{title}").isValid());
        assertTrue(engine.validateFilenameTemplate("{title} - {author}").isValid());
    }

    @Test
    void buildRenamedFilenameShouldAppendIndexAndKeepExtension() {
        Map<String, String> vars = vars("Andy Weir", "Project Hail Mary");

        assertEquals("Project Hail Mary.m4b", engine.buildRenamedFilename("{title}", vars, "m4b", null));
        assertEquals("Project Hail Mary - 2.mp3", engine.buildRenamedFilename("{title}", vars, ".mp3", 2));
    }

    @Test
    void generatePreviewsShouldRenderEverySampleBook() {
        List<String> previews = engine.generatePreviews("{author}/{title}");

        assertEquals(3, previews.size());
        assertEquals("Andy Weir/Project Hail Mary", previews.get(2));
    }

    private static Map<String, String> vars(String author, String title) {
        Map<String, String> vars = new HashMap<>();
        vars.put("author", author);
        vars.put("title", title);
        return vars;
    }
}

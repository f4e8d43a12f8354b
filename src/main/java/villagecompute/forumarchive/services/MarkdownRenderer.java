/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.List;

import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;

/**
 * Renders topic bodies from Markdown to HTML with flexmark.
 *
 * <p>
 * Dialect: CommonMark (fenced code included) plus GFM tables. Soft line breaks render as {@code <br />} because
 * forum posts were written with single newlines meaning line breaks.
 *
 * <p>
 * Rendering is a pure function of the input, so a topic rendered at load time never needs re-rendering. Parser and
 * renderer instances are immutable and shared.
 */
public class MarkdownRenderer {

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownRenderer() {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
        options.set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    /**
     * @param markdown
     *            raw Markdown, may be {@code null}
     * @return rendered HTML, empty for blank input
     */
    public String render(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        return renderer.render(parser.parse(markdown));
    }
}

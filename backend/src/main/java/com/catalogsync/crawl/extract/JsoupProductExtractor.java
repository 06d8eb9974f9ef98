package com.catalogsync.crawl.extract;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.VariantRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.catalogsync.crawl.model.ProductRecord.NOT_FOUND;

@Component
public class JsoupProductExtractor implements ProductExtractor {
    private final CrawlerProperties.Selectors selectors;

    public JsoupProductExtractor(CrawlerProperties properties) {
        this.selectors = properties.getSelectors();
    }

    @Override
    public ProductRecord extract(String body, String pageUrl, String category) {
        if (body == null || body.isBlank()) {
            return null;
        }
        Document document = Jsoup.parse(body, pageUrl == null ? "" : pageUrl);
        return new ProductRecord(
            pageUrl,
            textOrNotFound(document.selectFirst(selectors.getProductTitle())),
            textOrNotFound(document.selectFirst(selectors.getProductPrice())),
            flexibleField(document, selectors.getCompositionLabel()),
            flexibleField(document, selectors.getSkeinWeightLabel()),
            flexibleField(document, selectors.getSkeinLengthLabel()),
            flexibleField(document, selectors.getPackageWeightLabel()),
            category,
            linkOrNull(document.selectFirst(selectors.getMainImageLink())),
            null,
            Instant.now(),
            variants(document)
        );
    }

    @Override
    public List<VariantRecord> extractVariants(String body, String pageUrl) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        return variants(Jsoup.parse(body, pageUrl == null ? "" : pageUrl));
    }

    private List<VariantRecord> variants(Document document) {
        List<VariantRecord> variants = new ArrayList<>();
        Instant now = Instant.now();
        for (Element sample : document.select(selectors.getVariant())) {
            variants.add(new VariantRecord(
                textOrNotFound(sample.selectFirst(selectors.getVariantArticleNumber())),
                textOrNotFound(sample.selectFirst(selectors.getVariantName())),
                isAvailable(sample),
                linkOrNull(sample.selectFirst(selectors.getVariantImageLink())),
                null,
                now
            ));
        }
        return variants;
    }

    // In stock means a cart link is present and the "missing" marker does not say so.
    private boolean isAvailable(Element sample) {
        if (sample.selectFirst(selectors.getVariantCartLink()) == null) {
            return false;
        }
        Element missing = sample.selectFirst(selectors.getVariantMissingMarker());
        return missing == null || !missing.text().trim().equals(selectors.getUnavailableText());
    }

    /**
     * Looks up a labelled product field. The value is either a dedicated value element or, for inline
     * labels, the field text with the label removed.
     */
    private String flexibleField(Document document, String label) {
        for (Element field : document.select(selectors.getProductField())) {
            Element labelElement = field.selectFirst(selectors.getProductFieldLabel());
            if (labelElement == null || !labelElement.text().contains(label)) {
                continue;
            }
            Element value = field.selectFirst(selectors.getProductFieldValue());
            if (value != null) {
                return value.text().trim();
            }
            String labelText = labelElement.text().trim();
            return field.text().replace(labelText, "").trim();
        }
        return NOT_FOUND;
    }

    private static String textOrNotFound(Element element) {
        if (element == null) {
            return NOT_FOUND;
        }
        return element.text().trim();
    }

    private static String linkOrNull(Element link) {
        if (link == null) {
            return null;
        }
        String href = link.absUrl("href");
        return href.isBlank() ? null : href;
    }
}

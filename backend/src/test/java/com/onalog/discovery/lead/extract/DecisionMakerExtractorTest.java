package com.onalog.discovery.lead.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onalog.discovery.lead.model.DecisionMaker;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DecisionMakerExtractorTest {
    private final DecisionMakerExtractor extractor = new DecisionMakerExtractor(new JsonLdReader(new ObjectMapper()));

    @Test
    void readsTeamCardsNameTitleLinesAndStructuredData() {
        Document document = Jsoup.parse(
            """
                <html><head>
                <script type="application/ld+json">
                {"@type":"Organization","name":"Acme","founder":{"@type":"Person","name":"Mary Achieng"}}
                </script>
                </head><body>
                <div class="team-member">
                  <h3>Jane Wanjiru</h3>
                  <h4>Chief Executive Officer</h4>
                  <a href="mailto:jane@acme.co.ke">Email Jane</a>
                </div>
                <p>John Otieno - Managing Director</p>
                <p>Peter Kamau, CFO, peter@acme.co.ke</p>
                <ul><li>Read More - Services</li><li>Grace Njeri - Receptionist</li></ul>
                </body></html>
                """,
            "https://acme.co.ke/about"
        );

        List<DecisionMaker> people = extractor.extract(document);

        assertThat(people)
            .extracting(DecisionMaker::name, DecisionMaker::title, DecisionMaker::email)
            .containsExactly(
                tuple("Jane Wanjiru", "Chief Executive Officer", "jane@acme.co.ke"),
                tuple("John Otieno", "Managing Director", null),
                tuple("Peter Kamau", "CFO", "peter@acme.co.ke"),
                tuple("Mary Achieng", "Founder", null)
            );
        assertThat(people.get(3).source()).isEqualTo("structured_data");
    }

    @Test
    void mergeFillsMissingEmailAndRespectsMax() {
        List<DecisionMaker> base = List.of(new DecisionMaker("John Otieno", "Director", null, "website", 0.75));
        List<DecisionMaker> additions = List.of(
            new DecisionMaker("john otieno", "Director", "john@acme.co.ke", "website", 0.9),
            new DecisionMaker("Ann Mwangi", "COO", null, "website", 0.75),
            new DecisionMaker("Tom Ouma", "CTO", null, "website", 0.75)
        );

        List<DecisionMaker> merged = DecisionMakerExtractor.merge(base, additions, 2);

        assertThat(merged).hasSize(2);
        assertThat(merged.get(0).email()).isEqualTo("john@acme.co.ke");
        assertThat(merged.get(0).confidence()).isEqualTo(0.9);
        assertThat(merged.get(1).name()).isEqualTo("Ann Mwangi");
    }

    @Test
    void nameAndTitleHeuristics() {
        assertThat(DecisionMakerExtractor.isPersonName("Dr. Amina Hassan")).isTrue();
        assertThat(DecisionMakerExtractor.isPersonName("Meet The Team")).isFalse();
        assertThat(DecisionMakerExtractor.isPersonName("jane doe")).isFalse();
        assertThat(DecisionMakerExtractor.isExecutiveTitle("Directora General")).isTrue();
        assertThat(DecisionMakerExtractor.isExecutiveTitle("Barista")).isFalse();
    }
}

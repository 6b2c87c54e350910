package net.recipecatalog.domain.catalog;

import static net.recipecatalog.testutil.RecipeTestData.NOW;
import static net.recipecatalog.testutil.RecipeTestData.catalogOf;
import static net.recipecatalog.testutil.RecipeTestData.catalogWithKeys;
import static net.recipecatalog.testutil.RecipeTestData.recipe;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RecipeCatalogTest {

    @Test
    void should_ProposeCountPlusOne_When_AskedForNextKey() {
        assertThat(RecipeCatalog.empty().nextKeyCandidate()).isEqualTo(1);
        assertThat(catalogWithKeys("1", "2", "5").nextKeyCandidate()).isEqualTo(4);
    }

    @Test
    void should_SkipOccupiedKeys_When_FindingFreeKey() {
        RecipeCatalog catalog = catalogWithKeys("1", "3", "4");

        assertThat(catalog.firstFreeKeyFrom(3)).isEqualTo(5);
        assertThat(catalog.firstFreeKeyFrom(2)).isEqualTo(2);
    }

    @Test
    void should_ReturnSameSnapshot_When_RemovingAbsentKey() {
        RecipeCatalog catalog = catalogOf("Soup");

        assertThat(catalog.without("9")).isSameAs(catalog);
    }

    @Test
    void should_LeaveOriginalUnchanged_When_Mutated() {
        RecipeCatalog original = catalogOf("Soup");

        RecipeCatalog added = original.with("2", recipe("Salad"));
        RecipeCatalog removed = original.without("1");

        assertThat(original.asMap()).containsOnlyKeys("1");
        assertThat(added.asMap()).containsOnlyKeys("1", "2");
        assertThat(removed.isEmpty()).isTrue();
        assertThatThrownBy(() -> original.asMap().put("3", recipe("Pie")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void should_MatchNormalizedTitle_When_CaseAndWhitespaceDiffer() {
        Recipe stored = catalogOf("Tomato Soup").find("1").orElseThrow();

        assertThat(Recipe.normalizeTitle("  TOMATO soup ")).isEqualTo(stored.normalizedTitle());
        assertThat(Recipe.normalizeTitle("Tomato")).isNotEqualTo(stored.normalizedTitle());
    }

    @Test
    void should_ReplaceCandidatesWithChosenUrl_When_ImageSelected() {
        Recipe stamped = recipe("Soup").stampedForCatalog("1", NOW, List.of("https://a.jpg", "https://b.jpg"));

        Recipe selected = stamped.withSelectedImage("https://b.jpg");

        assertThat(selected.imageUrl()).contains("https://b.jpg");
        assertThat(selected.fields()).doesNotContainKey(Recipe.IMAGE_SEARCH_RESULTS);
        assertThat(selected.key()).contains("1");
        assertThat(stamped.imageSearchResults()).containsExactly("https://a.jpg", "https://b.jpg");
    }
}

package dev.memorynotify.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PhotoAsset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FacePreferenceAssetSelectorTest {

  private static final PhotoAsset WITH_TOP = TestFixtures.image("a-top");
  private static final PhotoAsset WITH_NAMED = TestFixtures.image("b-named");
  private static final PhotoAsset WITHOUT_FACE = TestFixtures.image("c-none");
  private static final Person TOP = new Person("p-top", "Alice", 0L);
  private static final Person NAMED = new Person("p-named", "Bob", 0L);
  private static final Person UNNAMED = new Person("p-unnamed", "", 0L);

  @Mock private PhotoServiceClient photoServiceClient;

  @Test
  void alwaysPicksTopPersonAssetWhileOneRemains() {
    stubFaces();
    final FacePreferenceAssetSelector selector = selector(new Random(3));

    for (int i = 0; i < 20; i++) {
      assertThat(
              selector.select(
                  "key-1", List.of(WITHOUT_FACE, WITH_NAMED, WITH_TOP), Set.of(), Set.of("p-top")))
          .contains(WITH_TOP);
    }
  }

  @Test
  void fallsBackToNamedFaceWhenTopPersonAssetWasSent() {
    stubFaces();

    final Optional<PhotoAsset> selected =
        selector(new Random(3))
            .select(
                "key-1",
                List.of(WITHOUT_FACE, WITH_NAMED, WITH_TOP),
                Set.of("a-top"),
                Set.of("p-top"));

    assertThat(selected).contains(WITH_NAMED);
    verify(photoServiceClient, never()).fetchAssetPeople("key-1", "a-top");
  }

  @Test
  void withoutTopPersonsNamedFacesWin() {
    stubFaces();

    assertThat(
            selector(new Random(5))
                .select("key-1", List.of(WITHOUT_FACE, WITH_TOP, WITH_NAMED), Set.of(), Set.of()))
        .get()
        .isIn(WITH_TOP, WITH_NAMED);
  }

  @Test
  void faceLookupFailureDropsAssetIntoLowestTier() {
    when(photoServiceClient.fetchAssetPeople("key-1", "a-top"))
        .thenThrow(
            new PhotoServiceIntegrationException(
                PhotoServiceIntegrationException.Reason.BAD_GATEWAY, "down"));
    when(photoServiceClient.fetchAssetPeople("key-1", "b-named")).thenReturn(List.of(NAMED));

    assertThat(
            selector(new Random(1))
                .select("key-1", List.of(WITH_TOP, WITH_NAMED), Set.of(), Set.of("p-top")))
        .contains(WITH_NAMED);
  }

  @Test
  void everyAssetAlreadySentFallsBackToOriginalList() {
    final Optional<PhotoAsset> selected =
        selector(TestFixtures.minRandom())
            .select("key-1", List.of(WITH_NAMED, WITH_TOP), Set.of("b-named", "a-top"), Set.of());

    assertThat(selected).contains(WITH_NAMED);
    verify(photoServiceClient, never()).fetchAssetPeople(anyString(), anyString());
  }

  @Test
  void emptyListSelectsNothing() {
    assertThat(selector(new Random(1)).select("key-1", List.of(), Set.of(), Set.of())).isEmpty();
  }

  private void stubFaces() {
    lenient()
        .when(photoServiceClient.fetchAssetPeople("key-1", "a-top"))
        .thenReturn(List.of(TOP, NAMED));
    lenient()
        .when(photoServiceClient.fetchAssetPeople("key-1", "b-named"))
        .thenReturn(List.of(NAMED, UNNAMED));
    lenient()
        .when(photoServiceClient.fetchAssetPeople("key-1", "c-none"))
        .thenReturn(List.of(UNNAMED));
  }

  private FacePreferenceAssetSelector selector(Random random) {
    return new FacePreferenceAssetSelector(
        photoServiceClient, TestFixtures.immediateRetry(), random);
  }
}

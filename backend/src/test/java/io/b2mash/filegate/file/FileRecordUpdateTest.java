package io.b2mash.filegate.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.b2mash.filegate.exception.InvalidRequestException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FileRecordUpdateTest {

  @Test
  void fromFields_distinguishesAbsentFromExplicitNull() {
    var fields = new HashMap<String, Object>();
    fields.put("remark", null);

    var update = FileRecordUpdate.fromFields(fields);

    assertThat(update.remark()).isNotNull();
    assertThat(update.remark().value()).isNull();
    assertThat(update.slug()).isNull();
    assertThat(update.isEmpty()).isFalse();
  }

  @Test
  void fromFields_emptyMapIsEmptyUpdate() {
    assertThat(FileRecordUpdate.fromFields(Map.of()).isEmpty()).isTrue();
  }

  @Test
  void fromFields_zeroMaxViewsMeansUnlimited() {
    var update = FileRecordUpdate.fromFields(Map.of("max_views", 0));

    assertThat(update.maxViews().value()).isNull();
  }

  @Test
  void fromFields_rejectsNonNumericMaxViews() {
    assertThatThrownBy(() -> FileRecordUpdate.fromFields(Map.of("max_views", "lots")))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void fromFields_parsesUseProxyFlagForms() {
    assertThat(FileRecordUpdate.fromFields(Map.of("use_proxy", "0")).useProxy().value()).isFalse();
    assertThat(FileRecordUpdate.fromFields(Map.of("use_proxy", 1)).useProxy().value()).isTrue();
    assertThat(FileRecordUpdate.fromFields(Map.of("use_proxy", false)).useProxy().value())
        .isFalse();
  }

  @Test
  void expiryPolicy_fromHoursIgnoresNonPositive() {
    assertThat(ExpiryPolicy.fromHours(null)).isNull();
    assertThat(ExpiryPolicy.fromHours(0)).isNull();
    assertThat(ExpiryPolicy.fromHours(-3)).isNull();
    assertThat(ExpiryPolicy.fromHours(2))
        .isCloseTo(Instant.now().plus(2, ChronoUnit.HOURS), within(5, ChronoUnit.SECONDS));
  }

  @Test
  void expiryPolicy_parseExplicitMapsNeverToSentinel() {
    assertThat(ExpiryPolicy.parseExplicit(null)).isEqualTo(ExpiryPolicy.NEVER);
    assertThat(ExpiryPolicy.parseExplicit("never")).isEqualTo(ExpiryPolicy.NEVER);
    assertThat(ExpiryPolicy.parseExplicit("2031-05-01T10:00:00+02:00"))
        .isEqualTo(Instant.parse("2031-05-01T08:00:00Z"));
  }

  @Test
  void expiryPolicy_parseExplicitRejectsGarbage() {
    assertThatThrownBy(() -> ExpiryPolicy.parseExplicit("tomorrow"))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void passwordHasher_saltsEachHash() {
    var hasher = new PasswordHasher();

    String first = hasher.hash("pw");
    String second = hasher.hash("pw");

    assertThat(first).isNotEqualTo(second);
    assertThat(hasher.matches("pw", first)).isTrue();
    assertThat(hasher.matches("wrong", first)).isFalse();
    assertThat(hasher.matches("pw", "garbage")).isFalse();
  }
}

package io.b2mash.filegate.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "system_settings")
public class SystemSetting {

  @Id
  @Column(name = "key", nullable = false, length = 100)
  private String key;

  @Column(name = "value", columnDefinition = "TEXT")
  private String value;

  protected SystemSetting() {}

  public SystemSetting(String key, String value) {
    this.key = key;
    this.value = value;
  }

  public void changeValue(String value) {
    this.value = value;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }
}

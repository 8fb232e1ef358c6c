/*
 * Where: Notifier configuration binding
 * What: Holds the ordered list of notification recipients
 * Why: Users are processed in configuration order and keyed by name in the state file
 */
package dev.memorynotify.notifier.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier")
@Validated
public record NotifierUsersProperties(@NotNull List<@Valid NotifierUser> users) {

  public NotifierUsersProperties {
    users = users == null ? List.of() : List.copyOf(users);
  }

  @AssertTrue(message = "notifier.users[].name must be unique")
  public boolean isUserNamesUnique() {
    final Set<String> seen = new HashSet<>();
    for (NotifierUser user : users) {
      if (user.name() != null && !seen.add(user.name())) {
        return false;
      }
    }
    return true;
  }

  public List<NotifierUser> enabledUsers() {
    return users.stream().filter(NotifierUser::isActive).toList();
  }
}

package dev.memorynotify.notifier.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class NotifierPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsUsersSettingsAndTemplates() {
    contextRunner
        .withPropertyValues(
            "notifier.users[0].name=alice",
            "notifier.users[0].api-key=key-a",
            "notifier.users[0].push-topic=memories-alice",
            "notifier.users[1].name=bob",
            "notifier.users[1].push-topic=memories-bob",
            "notifier.users[1].push-username=bob",
            "notifier.users[1].push-password=secret",
            "notifier.users[1].enabled=false",
            "notifier.settings.retry.max-attempts=4",
            "notifier.settings.retry.delay=2s",
            "notifier.settings.memory-notifications=2",
            "notifier.settings.notification-windows[0].start=08:00",
            "notifier.settings.notification-windows[0].end=10:00",
            "notifier.messages.memory[0]={years_ago} years ago",
            "photo-service.base-url=http://photos.local:2283/",
            "push-service.priority=high")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final NotifierUsersProperties users = context.getBean(NotifierUsersProperties.class);
              final NotifierSettingsProperties settings =
                  context.getBean(NotifierSettingsProperties.class);
              final MessageTemplateProperties messages =
                  context.getBean(MessageTemplateProperties.class);

              assertThat(users.users()).extracting(NotifierUser::name).containsExactly("alice", "bob");
              assertThat(users.enabledUsers()).extracting(NotifierUser::name).containsExactly("alice");
              assertThat(users.users().get(1).hasPushCredentials()).isTrue();
              assertThat(settings.retry().maxAttempts()).isEqualTo(4);
              assertThat(settings.retry().delay()).isEqualTo(Duration.ofSeconds(2));
              assertThat(settings.memoryNotifications()).isEqualTo(2);
              assertThat(settings.personNotifications()).isEqualTo(2);
              assertThat(settings.windowForSlot(1)).contains(new NotificationWindow("08:00", "10:00"));
              assertThat(settings.windowForSlot(2)).isEmpty();
              assertThat(messages.memory()).containsExactly("{years_ago} years ago");
              assertThat(messages.person()).isEmpty();
              assertThat(context.getBean(PhotoServiceProperties.class).baseUrl())
                  .isEqualTo("http://photos.local:2283");
              assertThat(context.getBean(PushServiceProperties.class).priority()).isEqualTo("high");
            });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final NotifierSettingsProperties settings =
              context.getBean(NotifierSettingsProperties.class);
          final PushServiceProperties push = context.getBean(PushServiceProperties.class);
          final PhotoServiceProperties photo = context.getBean(PhotoServiceProperties.class);

          assertThat(settings.retry().maxAttempts()).isEqualTo(3);
          assertThat(settings.retry().delay()).isEqualTo(Duration.ofSeconds(5));
          assertThat(settings.memoryNotifications()).isEqualTo(3);
          assertThat(settings.fallbackNotifications()).isEqualTo(3);
          assertThat(settings.topPersonsLimit()).isEqualTo(5);
          assertThat(settings.excludeRecentDays()).isEqualTo(30);
          assertThat(settings.stateFile()).isEqualTo("state.json");
          assertThat(context.getBean(NotifierUsersProperties.class).users()).isEmpty();
          assertThat(push.clickUrl()).isEqualTo("https://my.immich.app/");
          assertThat(push.memoryTags()).isEqualTo("camera,calendar");
          assertThat(photo.apiKeyHeaderName()).isEqualTo("x-api-key");
          assertThat(photo.personAssetPageSize()).isEqualTo(100);
        });
  }

  @Test
  void overnightWindowFailsStartup() {
    contextRunner
        .withPropertyValues(
            "notifier.settings.notification-windows[0].start=22:00",
            "notifier.settings.notification-windows[0].end=02:00")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void duplicateUserNamesFailStartup() {
    contextRunner
        .withPropertyValues(
            "notifier.users[0].name=alice",
            "notifier.users[0].push-topic=t1",
            "notifier.users[1].name=alice",
            "notifier.users[1].push-topic=t2")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shippedApplicationYamlBinds() {
    contextRunner
        .withInitializer(new ConfigDataApplicationContextInitializer())
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final NotifierSettingsProperties settings =
                  context.getBean(NotifierSettingsProperties.class);
              assertThat(settings.notificationWindows()).hasSize(5);
              assertThat(context.getBean(MessageTemplateProperties.class).memory()).isNotEmpty();
              assertThat(context.getBean(MessageTemplateProperties.class).videoMemory())
                  .isNotEmpty();
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    NotifierUsersProperties.class,
    NotifierSettingsProperties.class,
    MessageTemplateProperties.class,
    PhotoServiceProperties.class,
    PushServiceProperties.class
  })
  static class TestConfiguration {}
}

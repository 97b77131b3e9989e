package dbkit.error;

/**
 * Raised when a configuration value fails validation. The message names the setting.
 */
public final class InvalidSettingException extends DbKitException {

  private final String setting;

  public InvalidSettingException(String setting, String reason) {
    super(ErrorKind.INVALID_SETTING, "Invalid setting '" + setting + "': " + reason);
    this.setting = setting;
  }

  public InvalidSettingException(String setting, String reason, Throwable cause) {
    super(ErrorKind.INVALID_SETTING, "Invalid setting '" + setting + "': " + reason, cause);
    this.setting = setting;
  }

  public String setting() {
    return setting;
  }
}

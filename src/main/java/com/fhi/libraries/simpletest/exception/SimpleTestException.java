package com.fhi.libraries.simpletest.exception;

/**
 * Exception thrown when the framework is misused by its caller.
 *
 * <p>Expected "nothing found" outcomes (no preferred object, no failure line, no active test)
 * are never reported through this exception: they come back as empty values. This exception is
 * reserved for programmer errors, e.g. asking the run context for a resource kind that has
 * no registered factory.</p>
 *
 * <p>Use the static factory methods to build a meaningful {@code SimpleTestException}
 * with a specific cause enum and a descriptive message.</p>
 */
public class SimpleTestException extends RuntimeException
{
    /**
     * Enum representing the specific reason for the failure.
     */
   public enum Cause
   {
      UNKNOWN_RESOURCE      ("No factory registered for resource kind %s"),
      RESOURCE_CONSTRUCTION ("Factory for resource kind %s returned null"),
      VERSION_UNAVAILABLE   ("Cannot read version from classpath resource %s");

      private final String messageTemplate;

      Cause(String messageTemplate)
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args)
      {  return String.format(messageTemplate, args);
      }

      public String getMessageTemplate()
      {  return messageTemplate;
      }

      public String getCode()
      {   return this.name();
      }
   }

   private final Cause causeEnum;

   /**
    * Creates a new SimpleTestException with a specific cause and message.
    *
    * @param causeEnum a semantic reason from the {@code Cause} enum
    * @param message a human-readable description of the failure
    */
   public SimpleTestException(Cause causeEnum, String message)
   {  this(causeEnum, message, null);
   }

    /**
     * Creates a new SimpleTestException with a cause enum, message, and underlying exception.
     *
     * @param causeEnum a semantic reason from the {@code Cause} enum
     * @param message a human-readable description
     * @param cause the original exception that triggered this one
     */
    public SimpleTestException(Cause causeEnum, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
    }

    /**
     * Returns the reason for the failure.
     */
    public Cause getCauseEnum()
    {   return causeEnum;
    }


   /**
    * Returns the message of this exception and, if present, the message of its cause.
    *
    * <pre>
    * SimpleTestException: Main error message | Caused by: CauseClass: Cause message
    * </pre>
    */
   @Override
   public String toString()
   {
      String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());

      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null
            && !cause.getMessage().isBlank())
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }



    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

   public static SimpleTestException unknownResource(Class<?> kind)
   {  return new SimpleTestException(Cause.UNKNOWN_RESOURCE,
                                     Cause.UNKNOWN_RESOURCE.format(kind.getName()));
   }

    public static SimpleTestException resourceConstruction(Class<?> kind)
    {   return new SimpleTestException(Cause.RESOURCE_CONSTRUCTION,
                                       Cause.RESOURCE_CONSTRUCTION.format(kind.getName()));
    }

    /**
     * @param cause pass null if no Throwable cause.
     */
    public static SimpleTestException versionUnavailable(String resourcePath, Throwable cause)
    {   return new SimpleTestException(Cause.VERSION_UNAVAILABLE,
                                       Cause.VERSION_UNAVAILABLE.format(resourcePath),
                                       cause);
    }
}

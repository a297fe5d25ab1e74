package com.sproutsocial.rmq.format;

public enum OutputFormat {

    PLAIN {
        @Override
        public MessageFormatter newFormatter() {
            return new TextMessageFormatter();
        }
    },

    JSON {
        @Override
        public MessageFormatter newFormatter() {
            return new JsonMessageFormatter();
        }
    },

    TABLE {
        @Override
        public MessageFormatter newFormatter() {
            return new TableMessageFormatter();
        }
    };

    public abstract MessageFormatter newFormatter();

    public String displayName() {
        return name().toLowerCase();
    }

}

package com.restdis.constants;

public interface RestProtocol
{
    // Request paths. Everything else is a path-encoded command.
    String ROOT_PATH = "";
    String PIPELINE_PATH = "/pipeline";

    // Authentication sources.
    String TOKEN_QUERY_PARAM = "_token";
    String AUTHORIZATION_HEADER = "Authorization";
    String BEARER_PREFIX = "Bearer ";

    // Only these methods are accepted, whatever the command source.
    String METHOD_GET = "GET";
    String METHOD_POST = "POST";

    // Envelope fields.
    String FIELD_RESULT = "result";
    String FIELD_ERROR = "error";

    // Backing store commands issued by the server itself.
    String CMD_AUTH = "AUTH";
    String CMD_ACL = "ACL";
    String ACL_GENPASS = "GENPASS";
    String ACL_RESTTOKEN = "RESTTOKEN";

    // Validation errors, matched verbatim by callers.
    String ERR_UNAUTHORIZED = "Unauthorized";
    String ERR_PARSE_COMMAND = "ERR failed to parse command";
    String ERR_EMPTY_COMMAND = "ERR empty command";
    String ERR_PARSE_PIPELINE = "ERR failed to parse pipeline request";
    String ERR_EMPTY_PIPELINE = "ERR empty pipeline request";
    String ERR_EMPTY_PIPELINE_COMMAND = "ERR empty pipeline command";
    String ERR_RESTTOKEN_SYNTAX = "ERR invalid syntax. Usage: ACL RESTTOKEN username password";
    String ERR_GENPASS_REPLY = "ERR unexpected ACL GENPASS reply";

    // Status codes used by the envelope.
    int STATUS_OK = 200;
    int STATUS_BAD_REQUEST = 400;
    int STATUS_UNAUTHORIZED = 401;
    int STATUS_METHOD_NOT_ALLOWED = 405;
    int STATUS_INTERNAL_ERROR = 500;
}
